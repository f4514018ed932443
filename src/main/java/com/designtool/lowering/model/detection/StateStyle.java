package com.designtool.lowering.model.detection;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Interaction state of one variant with the style properties it overrides
 * relative to the default variant.
 */
@Value
@Builder
public class StateStyle {
    InteractionState state;
    String variantName;
    Map<String, String> styleOverrides;
    /** Spinner, error or success glyph present in the variant. */
    boolean hasIndicator;
}

package com.designtool.lowering.model.style;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Named design tokens collected from the registered styles. Every map keeps
 * insertion order.
 */
@Value
@Builder
public class DesignTokens {
    Map<String, String> colors;
    Map<String, Double> spacing;
    Map<String, Double> radii;
    Map<String, TypographyToken> typography;
    Map<String, ShadowStyle> shadows;

    public static DesignTokens empty() {
        return DesignTokens.builder()
                .colors(Map.of())
                .spacing(Map.of())
                .radii(Map.of())
                .typography(Map.of())
                .shadows(Map.of())
                .build();
    }
}

package com.designtool.lowering.model.raw;

import lombok.Builder;
import lombok.Value;

/**
 * Explicit flow-layout metadata authored in the design tool.
 * Alignment values keep the tool's vocabulary (MIN, CENTER, MAX, SPACE_BETWEEN, ...).
 */
@Value
@Builder
public class AutoLayout {
    LayoutMode mode;
    Double gap;
    Padding padding;
    String mainAxisAlign;
    String crossAxisAlign;
    boolean wrap;
}

package com.designtool.lowering.model.style;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ShadowStyle {
    String color;
    double offsetX;
    double offsetY;
    double blur;
    double spread;
    /** Inner shadow. */
    boolean inset;
}

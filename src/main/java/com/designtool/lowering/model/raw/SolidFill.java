package com.designtool.lowering.model.raw;

import lombok.Value;

@Value
public class SolidFill implements Fill {
    RgbaColor color;
    double opacity;

    public static SolidFill of(RgbaColor color) {
        return new SolidFill(color, 1.0);
    }

    public double effectiveAlpha() {
        return color.getA() * opacity;
    }
}

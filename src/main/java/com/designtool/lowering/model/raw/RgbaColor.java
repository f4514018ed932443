package com.designtool.lowering.model.raw;

import lombok.Value;

/**
 * Colour with 0-255 channels and a 0-1 alpha.
 */
@Value
public class RgbaColor {
    int r;
    int g;
    int b;
    double a;

    public static RgbaColor opaque(int r, int g, int b) {
        return new RgbaColor(r, g, b, 1.0);
    }
}

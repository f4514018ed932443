package com.designtool.lowering.model.raw;

import lombok.Value;

/**
 * Absolute position and size of a node in design-tool coordinates.
 */
@Value
public class BoundingBox {
    public static final BoundingBox ZERO = new BoundingBox(0, 0, 0, 0);

    double x;
    double y;
    double width;
    double height;

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }
}

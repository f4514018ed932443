package com.designtool.lowering.model.raw;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Value;

/**
 * Per-corner radii. A uniform radius has all four corners equal.
 */
@Value
public class CornerRadius {
    double topLeft;
    double topRight;
    double bottomRight;
    double bottomLeft;

    public static CornerRadius uniform(double radius) {
        return new CornerRadius(radius, radius, radius, radius);
    }

    @JsonIgnore
    public boolean isUniform() {
        return topLeft == topRight && topRight == bottomRight && bottomRight == bottomLeft;
    }

    @JsonIgnore
    public boolean isZero() {
        return isUniform() && topLeft == 0;
    }

    /** Top corners rounded, bottom corners square. */
    @JsonIgnore
    public boolean isTopRoundedOnly() {
        return topLeft > 0 && topRight > 0 && bottomRight == 0 && bottomLeft == 0;
    }

    /** Bottom corners rounded, top corners square. */
    @JsonIgnore
    public boolean isBottomRoundedOnly() {
        return topLeft == 0 && topRight == 0 && bottomRight > 0 && bottomLeft > 0;
    }
}

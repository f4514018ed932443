package com.designtool.lowering.model.raw;

public enum VerticalConstraint {
    TOP,
    BOTTOM,
    CENTER,
    TOP_BOTTOM,
    SCALE
}

package com.designtool.lowering.model.raw;

public enum HorizontalConstraint {
    LEFT,
    RIGHT,
    CENTER,
    LEFT_RIGHT,
    SCALE
}

package com.designtool.lowering.model.raw;

public enum OverflowDirection {
    NONE,
    HORIZONTAL_SCROLLING,
    VERTICAL_SCROLLING,
    HORIZONTAL_AND_VERTICAL_SCROLLING
}

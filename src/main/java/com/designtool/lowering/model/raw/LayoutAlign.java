package com.designtool.lowering.model.raw;

public enum LayoutAlign {
    INHERIT,
    STRETCH,
    MIN,
    CENTER,
    MAX
}

package com.designtool.lowering.model.raw;

public enum LayoutPositioning {
    AUTO,
    ABSOLUTE
}

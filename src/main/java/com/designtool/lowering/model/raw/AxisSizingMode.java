package com.designtool.lowering.model.raw;

public enum AxisSizingMode {
    FIXED,
    AUTO
}

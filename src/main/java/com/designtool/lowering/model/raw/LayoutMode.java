package com.designtool.lowering.model.raw;

public enum LayoutMode {
    NONE,
    HORIZONTAL,
    VERTICAL
}

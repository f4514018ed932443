package com.designtool.lowering.model.layout;

import lombok.Value;

@Value
public class LayoutSizing {
    public static final LayoutSizing FIXED = new LayoutSizing(Sizing.FIXED, Sizing.FIXED);

    Sizing horizontal;
    Sizing vertical;
}

package com.designtool.lowering.model.detection;

import lombok.Value;

@Value
public class SafeAreaInsets {
    public static final SafeAreaInsets ZERO = new SafeAreaInsets(0, 0, 0, 0);

    double top;
    double bottom;
    double left;
    double right;
}

package com.designtool.lowering.model.raw;

import lombok.Value;

@Value
public class Stroke {
    RgbaColor color;
    double weight;
    double opacity;
    String align;
}

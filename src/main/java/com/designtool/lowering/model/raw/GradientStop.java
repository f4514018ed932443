package com.designtool.lowering.model.raw;

import lombok.Value;

@Value
public class GradientStop {
    double position;
    RgbaColor color;
}

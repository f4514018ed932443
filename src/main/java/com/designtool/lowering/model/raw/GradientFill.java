package com.designtool.lowering.model.raw;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class GradientFill implements Fill {
    GradientType gradientType;
    @Singular
    List<GradientStop> stops;
    /** Angle in degrees, only meaningful for linear gradients. */
    Double angle;
    @Builder.Default
    double opacity = 1.0;
}

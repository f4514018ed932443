package com.designtool.lowering.model.style;

import java.util.List;

import com.designtool.lowering.model.raw.GradientType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GradientStyle {
    GradientType type;
    List<String> colors;
    List<Double> positions;
    Double angle;
}

package com.designtool.lowering.model.raw;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Effect {
    EffectType type;
    RgbaColor color;
    double offsetX;
    double offsetY;
    double radius;
    double spread;
}

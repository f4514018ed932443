package com.designtool.lowering.model.raw;

public enum EffectType {
    DROP_SHADOW,
    INNER_SHADOW,
    LAYER_BLUR,
    BACKGROUND_BLUR;

    public boolean isShadow() {
        return this == DROP_SHADOW || this == INNER_SHADOW;
    }
}

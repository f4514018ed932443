package com.designtool.lowering.model.raw;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GradientType {
    LINEAR("linear"),
    RADIAL("radial"),
    ANGULAR("angular"),
    DIAMOND("diamond");

    private final String value;

    GradientType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

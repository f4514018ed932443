package com.designtool.lowering.model.ir;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ButtonVariant {
    PRIMARY("primary"),
    SECONDARY("secondary"),
    OUTLINE("outline"),
    GHOST("ghost");

    private final String value;

    ButtonVariant(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

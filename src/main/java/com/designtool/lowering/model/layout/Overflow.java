package com.designtool.lowering.model.layout;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Overflow {
    SCROLL("scroll"),
    HIDDEN("hidden");

    private final String value;

    Overflow(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

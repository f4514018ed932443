package com.designtool.lowering.model.layout;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Sizing {
    FIXED("fixed"),
    FILL("fill"),
    HUG("hug");

    private final String value;

    Sizing(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

package com.designtool.lowering.model.layout;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrossAlign {
    START("start"),
    CENTER("center"),
    END("end"),
    STRETCH("stretch"),
    BASELINE("baseline");

    private final String value;

    CrossAlign(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

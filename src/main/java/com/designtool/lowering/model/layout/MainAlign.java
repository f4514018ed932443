package com.designtool.lowering.model.layout;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MainAlign {
    START("start"),
    CENTER("center"),
    END("end"),
    SPACE_BETWEEN("space-between"),
    SPACE_AROUND("space-around");

    private final String value;

    MainAlign(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

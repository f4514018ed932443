package com.designtool.lowering.model.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ListOrientation {
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String value;

    ListOrientation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

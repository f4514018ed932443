package com.designtool.lowering.model.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InteractionState {
    DEFAULT("default"),
    PRESSED("pressed"),
    DISABLED("disabled"),
    LOADING("loading"),
    ERROR("error"),
    HOVER("hover"),
    FOCUSED("focused");

    private final String value;

    InteractionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

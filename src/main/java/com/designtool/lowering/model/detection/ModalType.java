package com.designtool.lowering.model.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModalType {
    BOTTOM_SHEET("bottom-sheet"),
    TOP_SHEET("top-sheet"),
    DIALOG("dialog");

    private final String value;

    ModalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

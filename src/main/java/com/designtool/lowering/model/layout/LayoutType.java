package com.designtool.lowering.model.layout;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LayoutType {
    ROW("row"),
    COLUMN("column"),
    STACK("stack"),
    ABSOLUTE("absolute");

    private final String value;

    LayoutType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Row and column place children in flow; stack and absolute do not. */
    public boolean isFlow() {
        return this == ROW || this == COLUMN;
    }
}

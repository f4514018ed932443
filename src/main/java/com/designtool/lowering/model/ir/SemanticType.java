package com.designtool.lowering.model.ir;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SemanticType {
    CONTAINER("Container"),
    TEXT("Text"),
    IMAGE("Image"),
    ICON("Icon"),
    BUTTON("Button"),
    CARD("Card"),
    REPEATER("Repeater"),
    COMPONENT("Component");

    private final String label;

    SemanticType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

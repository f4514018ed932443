package com.designtool.lowering.model.detection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChromeElement {
    STATUS_BAR("status-bar"),
    HOME_INDICATOR("home-indicator"),
    SAFE_AREA("safe-area"),
    NAVIGATION_BAR("navigation-bar");

    private final String value;

    ChromeElement(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

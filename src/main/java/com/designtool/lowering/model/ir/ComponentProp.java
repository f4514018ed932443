package com.designtool.lowering.model.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Value;

/**
 * A prop exposed by a component instance, with the value seen in the design.
 */
@Value
public class ComponentProp {

    public enum Type {
        STRING("string"),
        IMAGE("image");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    Type type;
    String defaultValue;
}

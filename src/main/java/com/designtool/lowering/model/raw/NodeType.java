package com.designtool.lowering.model.raw;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Node types exported by the design tool. Anything the reader does not
 * recognize becomes {@link #UNKNOWN}.
 */
public enum NodeType {
    DOCUMENT,
    CANVAS,
    FRAME,
    GROUP,
    SECTION,
    RECTANGLE,
    VECTOR,
    BOOLEAN_OPERATION,
    STAR,
    LINE,
    ELLIPSE,
    REGULAR_POLYGON,
    TEXT,
    SLICE,
    COMPONENT,
    COMPONENT_SET,
    INSTANCE,
    UNKNOWN;

    private static final Set<NodeType> VECTOR_TYPES = EnumSet.of(
            VECTOR, BOOLEAN_OPERATION, STAR, ELLIPSE, REGULAR_POLYGON, LINE);

    private static final Set<NodeType> FRAME_TYPES = EnumSet.of(FRAME, GROUP);

    public boolean isVector() {
        return VECTOR_TYPES.contains(this);
    }

    public boolean isFrameLike() {
        return FRAME_TYPES.contains(this);
    }

    public static NodeType of(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}

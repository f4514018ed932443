package com.designtool.lowering.model.layout;

import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Value;

/**
 * What a node needs to know about its parent to resolve sizing and positioning.
 * The root has neither a layout type nor bounds.
 */
@Value
public class ParentContext {
    public static final ParentContext ROOT = new ParentContext(null, null);

    LayoutType type;
    BoundingBox bounds;

    public boolean isRoot() {
        return type == null;
    }
}

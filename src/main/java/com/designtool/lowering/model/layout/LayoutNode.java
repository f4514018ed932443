package com.designtool.lowering.model.layout;

import java.util.List;

import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A normalized node annotated with its resolved {@link LayoutMeta}.
 */
@Value
@Builder
public class LayoutNode {
    String id;
    String name;
    NodeType type;
    BoundingBox boundingBox;
    NodeProperties properties;
    LayoutMeta layout;
    /** Only set for nodes positioned by constraints. */
    AbsolutePlacement placement;
    @Singular
    List<LayoutNode> children;

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}

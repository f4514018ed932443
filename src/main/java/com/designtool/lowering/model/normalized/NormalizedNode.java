package com.designtool.lowering.model.normalized;

import java.util.List;

import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A node that survived filtering. Hidden, ignored and OS-chrome nodes are never
 * reachable from a normalized root.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedNode {
    String id;
    String name;
    NodeType type;
    BoundingBox boundingBox;
    NodeProperties properties;
    @Singular
    List<NormalizedNode> children;

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}

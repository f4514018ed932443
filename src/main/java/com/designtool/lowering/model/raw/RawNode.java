package com.designtool.lowering.model.raw;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A node as exported by the design tool, before any lowering pass.
 */
@Value
@Builder(toBuilder = true)
public class RawNode {
    String id;
    String name;
    NodeType type;
    /** {@code null} means visible. */
    Boolean visible;
    BoundingBox boundingBox;
    @Builder.Default
    NodeProperties properties = NodeProperties.EMPTY;
    @Singular
    List<RawNode> children;

    public boolean isHidden() {
        return Boolean.FALSE.equals(visible);
    }

    public BoundingBox boundsOrZero() {
        return boundingBox != null ? boundingBox : BoundingBox.ZERO;
    }
}

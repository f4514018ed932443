package com.designtool.lowering.model.ir;

import java.util.List;

import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.raw.BoundingBox;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Getter;

/**
 * A run of structurally identical siblings rendered from a data list.
 * The first child is the item template.
 */
@Getter
public final class RepeaterIr extends IrNode {
    private final String itemComponentName;
    private final String dataPropName;
    private final LayoutMeta layout;
    private final List<IrNode> children;

    @Builder
    public RepeaterIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                      String itemComponentName, String dataPropName, LayoutMeta layout, List<IrNode> children) {
        super(id, name, boundingBox, styleRef, propName);
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Repeater " + id + " needs at least one item");
        }
        this.itemComponentName = itemComponentName;
        this.dataPropName = dataPropName;
        this.layout = layout;
        this.children = List.copyOf(children);
    }

    @JsonIgnore
    public IrNode getTemplate() {
        return children.get(0);
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.REPEATER;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package com.designtool.lowering.model.ir;

import java.util.List;

import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

/**
 * Framed surface: rounded, shadowed or bordered container.
 */
@Getter
public final class CardIr extends IrNode {
    private final LayoutMeta layout;
    private final List<IrNode> children;

    @Builder
    public CardIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                       LayoutMeta layout, List<IrNode> children) {
        super(id, name, boundingBox, styleRef, propName);
        this.layout = layout;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.CARD;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

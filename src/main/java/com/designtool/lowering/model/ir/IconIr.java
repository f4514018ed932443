package com.designtool.lowering.model.ir;

import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

@Getter
public final class IconIr extends IrNode {
    private final String iconRef;
    private final double size;

    @Builder
    public IconIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                  String iconRef, double size) {
        super(id, name, boundingBox, styleRef, propName);
        this.iconRef = iconRef;
        this.size = size;
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.ICON;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package com.designtool.lowering.model.ir;

import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

@Getter
public final class ImageIr extends IrNode {
    /** Asset reference from the image fill, {@code null} for vector artwork. */
    private final String imageRef;
    private final String scaleMode;

    @Builder
    public ImageIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                   String imageRef, String scaleMode) {
        super(id, name, boundingBox, styleRef, propName);
        this.imageRef = imageRef;
        this.scaleMode = scaleMode;
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.IMAGE;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

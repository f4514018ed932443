package com.designtool.lowering.model.ir;

import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

@Getter
public final class TextIr extends IrNode {
    private final String text;
    private final String defaultValue;
    /** Recognized content kind such as {@code price} or {@code date}, or {@code null}. */
    private final String contentPattern;

    @Builder
    public TextIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                  String text, String contentPattern) {
        super(id, name, boundingBox, styleRef, propName);
        this.text = text;
        this.defaultValue = text;
        this.contentPattern = contentPattern;
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.TEXT;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

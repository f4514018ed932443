package com.designtool.lowering.model.ir;

import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

/**
 * Interactive element with a label and an optional icon. The label and icon
 * nodes are folded into the button; their styles are kept as a secondary pair.
 */
@Getter
public final class ButtonIr extends IrNode {
    private final String label;
    private final ButtonVariant variant;
    private final String iconRef;
    private final String textId;
    private final String iconId;
    private final LayoutMeta layout;
    private String textStyleRef;
    private String iconStyleRef;

    @Builder
    public ButtonIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                    String label, ButtonVariant variant, String iconRef, String textId, String iconId,
                    LayoutMeta layout) {
        super(id, name, boundingBox, styleRef, propName);
        this.label = label;
        this.variant = variant != null ? variant : ButtonVariant.PRIMARY;
        this.iconRef = iconRef;
        this.textId = textId;
        this.iconId = iconId;
        this.layout = layout;
    }

    public void assignTextStyleRef(String textStyleRef) {
        this.textStyleRef = textStyleRef;
    }

    public void assignIconStyleRef(String iconStyleRef) {
        this.iconStyleRef = iconStyleRef;
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.BUTTON;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

package com.designtool.lowering.model.ir;

import java.util.List;

import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Getter;

/**
 * Base class of the semantic IR. The set of variants is closed; consumers
 * dispatch through {@link IrNodeVisitor}.
 */
@Getter
public abstract sealed class IrNode
        permits ContainerIr, TextIr, ImageIr, IconIr, ButtonIr, CardIr, RepeaterIr, ComponentIr {

    private final String id;
    private final String name;
    private final BoundingBox boundingBox;
    private String styleRef;
    private String propName;

    protected IrNode(String id, String name, BoundingBox boundingBox, String styleRef, String propName) {
        this.id = id;
        this.name = name;
        this.boundingBox = boundingBox != null ? boundingBox : BoundingBox.ZERO;
        this.styleRef = styleRef;
        this.propName = propName;
    }

    public abstract SemanticType getSemanticType();

    public abstract <R> R accept(IrNodeVisitor<R> visitor);

    public List<IrNode> getChildren() {
        return List.of();
    }

    /**
     * Rewrites the style reference once styles have been deduplicated.
     */
    public void assignStyleRef(String styleRef) {
        this.styleRef = styleRef;
    }

    /**
     * Binds this node to a prop of the enclosing component.
     */
    public void assignPropName(String propName) {
        this.propName = propName;
    }
}

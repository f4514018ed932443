package com.designtool.lowering.model.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.raw.BoundingBox;

import lombok.Builder;
import lombok.Getter;

/**
 * Instance of a named design-system component.
 */
@Getter
public final class ComponentIr extends IrNode {
    private final String componentId;
    private final String componentName;
    private final Map<String, ComponentProp> props;
    private final LayoutMeta layout;
    private final List<IrNode> children;

    @Builder
    public ComponentIr(String id, String name, BoundingBox boundingBox, String styleRef, String propName,
                       String componentId, String componentName, Map<String, ComponentProp> props,
                       LayoutMeta layout, List<IrNode> children) {
        super(id, name, boundingBox, styleRef, propName);
        this.componentId = componentId;
        this.componentName = componentName;
        this.props = props != null ? Collections.unmodifiableMap(new LinkedHashMap<>(props)) : Map.of();
        this.layout = layout;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    @Override
    public SemanticType getSemanticType() {
        return SemanticType.COMPONENT;
    }

    @Override
    public <R> R accept(IrNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}

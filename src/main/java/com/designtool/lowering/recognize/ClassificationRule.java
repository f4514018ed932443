package com.designtool.lowering.recognize;

import java.util.function.Predicate;

import com.designtool.lowering.model.ir.SemanticType;
import com.designtool.lowering.model.layout.LayoutNode;

import lombok.Value;

/**
 * One step of the classification cascade: when {@code predicate} holds the
 * node becomes {@code result}.
 */
@Value
public class ClassificationRule {
    String name;
    Predicate<LayoutNode> predicate;
    SemanticType result;

    public boolean matches(LayoutNode node) {
        return predicate.test(node);
    }
}

package com.designtool.lowering.model.ir;

/**
 * Visitor over the closed set of IR variants. Adding a variant adds a method
 * here, so every consumer has to handle it before the code compiles again.
 */
public interface IrNodeVisitor<R> {
    R visit(ContainerIr container);
    R visit(TextIr text);
    R visit(ImageIr image);
    R visit(IconIr icon);
    R visit(ButtonIr button);
    R visit(CardIr card);
    R visit(RepeaterIr repeater);
    R visit(ComponentIr component);
}

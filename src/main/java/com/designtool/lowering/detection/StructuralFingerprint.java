package com.designtool.lowering.detection;

import com.designtool.lowering.model.ir.ButtonIr;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ComponentIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IconIr;
import com.designtool.lowering.model.ir.ImageIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.IrNodeVisitor;
import com.designtool.lowering.model.ir.RepeaterIr;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.util.SignatureHash;

/**
 * Structural signature of an IR subtree: semantic types only, names, text and
 * geometry excluded. Two subtrees with the same signature are interchangeable
 * up to content.
 */
public class StructuralFingerprint {

    private static final IrNodeVisitor<String> SIGNATURE = new SignatureVisitor();

    /**
     * Readable signature such as {@code Card:[Image,Text,Button]}.
     */
    public static String signatureOf(IrNode node) {
        return node.accept(SIGNATURE);
    }

    public static String fingerprintOf(IrNode node) {
        return SignatureHash.hashString(signatureOf(node));
    }

    private static final class SignatureVisitor implements IrNodeVisitor<String> {

        @Override
        public String visit(ContainerIr container) {
            return withChildren(container);
        }

        @Override
        public String visit(TextIr text) {
            return "Text";
        }

        @Override
        public String visit(ImageIr image) {
            return "Image";
        }

        @Override
        public String visit(IconIr icon) {
            return "Icon";
        }

        @Override
        public String visit(ButtonIr button) {
            return button.getIconId() != null ? "Button:[Icon]" : "Button";
        }

        @Override
        public String visit(CardIr card) {
            return withChildren(card);
        }

        @Override
        public String visit(RepeaterIr repeater) {
            return "Repeater:" + repeater.getChildren().size() + "x" + repeater.getTemplate().accept(this);
        }

        @Override
        public String visit(ComponentIr component) {
            return "Component(" + component.getComponentId() + ")";
        }

        private String withChildren(IrNode node) {
            String type = node.getSemanticType().getLabel();
            if (node.getChildren().isEmpty()) {
                return type;
            }
            StringBuilder sb = new StringBuilder(type).append(":[");
            for (int i = 0; i < node.getChildren().size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(node.getChildren().get(i).accept(this));
            }
            return sb.append(']').toString();
        }
    }
}

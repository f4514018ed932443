package com.designtool.lowering.detection;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.detection.ListHint;
import com.designtool.lowering.model.detection.ListOrientation;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.RepeaterIr;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.recognize.StyleRefNamer;
import com.designtool.lowering.util.NamingUtil;

/**
 * Finds containers whose children are same-shaped list items. Items inside a
 * detected list are not searched for nested lists.
 */
public class ListDetector {

    private static final Logger log = LoggerFactory.getLogger(ListDetector.class);

    public static final int MIN_LIST_ITEMS = 3;
    static final double SIZE_TOLERANCE = 0.1;

    public List<ListHint> detect(IrNode root) {
        List<ListHint> hints = new ArrayList<>();
        detect(root, hints);
        return hints;
    }

    private void detect(IrNode node, List<ListHint> hints) {
        LayoutMeta layout = listLayout(node);
        if (layout != null && isList(node.getChildren())) {
            List<IrNode> items = node.getChildren();
            ListHint hint = new ListHint(
                    node.getId(),
                    items.stream().map(IrNode::getId).toList(),
                    layout.getType() == LayoutType.ROW ? ListOrientation.HORIZONTAL : ListOrientation.VERTICAL,
                    itemType(items.get(0)));
            log.debug("LIST {} with {} {} items", node.getId(), items.size(), hint.getItemType());
            hints.add(hint);
            return;
        }
        for (IrNode child : node.getChildren()) {
            detect(child, hints);
        }
    }

    // Only containers, cards and repeaters can hold list items.
    private static LayoutMeta listLayout(IrNode node) {
        if (node instanceof ContainerIr container) {
            return container.getLayout();
        }
        if (node instanceof CardIr card) {
            return card.getLayout();
        }
        if (node instanceof RepeaterIr repeater) {
            return repeater.getLayout();
        }
        return null;
    }

    static boolean isList(List<IrNode> children) {
        if (children.size() < MIN_LIST_ITEMS) {
            return false;
        }
        IrNode first = children.get(0);
        String fingerprint = StructuralFingerprint.fingerprintOf(first);
        for (IrNode child : children.subList(1, children.size())) {
            if (!fingerprint.equals(StructuralFingerprint.fingerprintOf(child))
                    || !similarSize(first.getBoundingBox(), child.getBoundingBox())) {
                return false;
            }
        }
        return true;
    }

    static boolean similarSize(BoundingBox a, BoundingBox b) {
        return withinTolerance(a.getWidth(), b.getWidth()) && withinTolerance(a.getHeight(), b.getHeight());
    }

    private static boolean withinTolerance(double expected, double actual) {
        if (expected == 0) {
            return actual == 0;
        }
        return Math.abs(expected - actual) / expected <= SIZE_TOLERANCE;
    }

    static String itemType(IrNode item) {
        String baseName = NamingUtil.stripTrailingDigits(item.getName());
        if (!StyleRefNamer.isGenericName(baseName)) {
            String pascal = NamingUtil.toPascalCase(baseName);
            if (pascal.length() >= 3 && !pascal.startsWith("Element")) {
                return pascal.endsWith("Item") ? pascal : pascal + "Item";
            }
        }
        return switch (item.getSemanticType()) {
            case CARD -> "CardItem";
            case BUTTON -> "ButtonItem";
            case CONTAINER -> "ListItem";
            default -> "Item";
        };
    }
}

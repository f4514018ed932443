package com.designtool.lowering.layout;

import static com.designtool.lowering.layout.LayoutThresholds.CENTER_TOLERANCE;
import static com.designtool.lowering.layout.LayoutThresholds.END_LEADING_MIN;
import static com.designtool.lowering.layout.LayoutThresholds.END_TRAILING_MAX;

import java.util.List;

import com.designtool.lowering.model.layout.CrossAlign;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.MainAlign;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.AutoLayout;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.Padding;

/**
 * Resolves padding and alignment: explicit auto-layout values are mapped
 * through fixed tables, everything else is inferred from child geometry.
 */
public class LayoutExtractor {

    public Padding resolvePadding(NormalizedNode node) {
        AutoLayout autoLayout = node.getProperties().getAutoLayout();
        if (node.getProperties().hasAutoLayout() && autoLayout.getPadding() != null) {
            return autoLayout.getPadding();
        }
        return inferPadding(node);
    }

    /**
     * Distance from the container edges to the union of its children, clamped
     * at zero and rounded. All zeros for a childless node.
     */
    public Padding inferPadding(NormalizedNode node) {
        if (!node.hasChildren()) {
            return Padding.ZERO;
        }
        List<BoundingBox> boxes = node.getChildren().stream().map(NormalizedNode::getBoundingBox).toList();
        double minX = boxes.stream().mapToDouble(BoundingBox::getX).min().orElse(0);
        double minY = boxes.stream().mapToDouble(BoundingBox::getY).min().orElse(0);
        double maxX = boxes.stream().mapToDouble(BoundingBox::right).max().orElse(0);
        double maxY = boxes.stream().mapToDouble(BoundingBox::bottom).max().orElse(0);

        BoundingBox container = node.getBoundingBox();
        return new Padding(
                clampRound(minY - container.getY()),
                clampRound(container.right() - maxX),
                clampRound(container.bottom() - maxY),
                clampRound(minX - container.getX()));
    }

    public MainAlign resolveMainAlign(NormalizedNode node, LayoutType type) {
        if (node.getProperties().hasAutoLayout()) {
            return mapMainAlign(node.getProperties().getAutoLayout().getMainAxisAlign());
        }
        return type.isFlow() ? inferMainAxisAlign(node, type) : MainAlign.START;
    }

    public CrossAlign resolveCrossAlign(NormalizedNode node, LayoutType type) {
        if (node.getProperties().hasAutoLayout()) {
            return mapCrossAlign(node.getProperties().getAutoLayout().getCrossAxisAlign());
        }
        return type.isFlow() ? inferCrossAxisAlign(node, type) : CrossAlign.START;
    }

    static MainAlign mapMainAlign(String value) {
        if (value == null) {
            return MainAlign.START;
        }
        return switch (value) {
            case "MAX" -> MainAlign.END;
            case "CENTER" -> MainAlign.CENTER;
            case "SPACE_BETWEEN" -> MainAlign.SPACE_BETWEEN;
            case "SPACE_AROUND" -> MainAlign.SPACE_AROUND;
            default -> MainAlign.START;
        };
    }

    static CrossAlign mapCrossAlign(String value) {
        if (value == null) {
            return CrossAlign.START;
        }
        return switch (value) {
            case "MAX" -> CrossAlign.END;
            case "CENTER" -> CrossAlign.CENTER;
            case "BASELINE" -> CrossAlign.BASELINE;
            case "STRETCH" -> CrossAlign.STRETCH;
            default -> CrossAlign.START;
        };
    }

    MainAlign inferMainAxisAlign(NormalizedNode node, LayoutType type) {
        if (!node.hasChildren()) {
            return MainAlign.START;
        }
        boolean horizontal = type == LayoutType.ROW;
        List<BoundingBox> sorted = LayoutDetector.sortAlongAxis(
                node.getChildren().stream().map(NormalizedNode::getBoundingBox).toList(), horizontal);
        BoundingBox first = sorted.get(0);
        BoundingBox last = sorted.get(sorted.size() - 1);
        BoundingBox container = node.getBoundingBox();

        double leading = horizontal ? first.getX() - container.getX() : first.getY() - container.getY();
        double trailing = horizontal ? container.right() - last.right() : container.bottom() - last.bottom();

        if (Math.abs(leading - trailing) < CENTER_TOLERANCE) {
            return MainAlign.CENTER;
        }
        if (trailing < END_TRAILING_MAX && leading > END_LEADING_MIN) {
            return MainAlign.END;
        }
        return MainAlign.START;
    }

    CrossAlign inferCrossAxisAlign(NormalizedNode node, LayoutType type) {
        if (!node.hasChildren()) {
            return CrossAlign.START;
        }
        boolean horizontal = type == LayoutType.ROW;
        BoundingBox container = node.getBoundingBox();
        double leadingSum = 0;
        double trailingSum = 0;
        for (NormalizedNode child : node.getChildren()) {
            BoundingBox box = child.getBoundingBox();
            if (horizontal) {
                leadingSum += box.getY() - container.getY();
                trailingSum += container.bottom() - box.bottom();
            } else {
                leadingSum += box.getX() - container.getX();
                trailingSum += container.right() - box.right();
            }
        }
        int count = node.getChildren().size();
        double avgLeading = leadingSum / count;
        double avgTrailing = trailingSum / count;

        if (Math.abs(avgLeading - avgTrailing) < CENTER_TOLERANCE) {
            return CrossAlign.CENTER;
        }
        return avgTrailing < avgLeading ? CrossAlign.END : CrossAlign.START;
    }

    private static double clampRound(double value) {
        return Math.max(0, Math.round(value));
    }
}

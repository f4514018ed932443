package com.designtool.lowering.layout;

import static com.designtool.lowering.layout.LayoutThresholds.ALIGNMENT_TOLERANCE;
import static com.designtool.lowering.layout.LayoutThresholds.CROSS_AXIS_SPREAD;
import static com.designtool.lowering.layout.LayoutThresholds.STACK_OVERLAP_RATIO;

import java.util.Comparator;
import java.util.List;

import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.LayoutMode;

/**
 * Decides how a node places its children, from explicit auto-layout when the
 * designer set one, otherwise from the children's geometry.
 */
public class LayoutDetector {

    /**
     * Detection order: auto-layout, childless, single child, stack, row, column,
     * and absolute as the fallback.
     */
    public LayoutType detect(NormalizedNode node) {
        if (node.getProperties().hasAutoLayout()) {
            return node.getProperties().getAutoLayout().getMode() == LayoutMode.HORIZONTAL
                    ? LayoutType.ROW
                    : LayoutType.COLUMN;
        }

        List<BoundingBox> boxes = childBoxes(node);
        if (boxes.isEmpty()) {
            return LayoutType.ABSOLUTE;
        }
        if (boxes.size() == 1) {
            return LayoutType.COLUMN;
        }
        if (isStack(boxes)) {
            return LayoutType.STACK;
        }
        if (isRow(boxes)) {
            return LayoutType.ROW;
        }
        if (isColumn(boxes)) {
            return LayoutType.COLUMN;
        }
        return LayoutType.ABSOLUTE;
    }

    /**
     * Gap between consecutive children along the main axis: the explicit value
     * when present, else the rounded mean of the positive gaps.
     */
    public double calculateGap(NormalizedNode node, LayoutType type) {
        if (node.getProperties().hasAutoLayout() && node.getProperties().getAutoLayout().getGap() != null) {
            return node.getProperties().getAutoLayout().getGap();
        }
        if (!type.isFlow()) {
            return 0;
        }
        List<BoundingBox> boxes = childBoxes(node);
        if (boxes.size() < 2) {
            return 0;
        }

        boolean horizontal = type == LayoutType.ROW;
        List<BoundingBox> sorted = sortAlongAxis(boxes, horizontal);
        double sum = 0;
        int count = 0;
        for (int i = 1; i < sorted.size(); i++) {
            BoundingBox prev = sorted.get(i - 1);
            BoundingBox curr = sorted.get(i);
            double gap = horizontal ? curr.getX() - prev.right() : curr.getY() - prev.bottom();
            if (gap > 0) {
                sum += gap;
                count++;
            }
        }
        return count == 0 ? 0 : Math.round(sum / count);
    }

    boolean isRow(List<BoundingBox> boxes) {
        double minY = boxes.stream().mapToDouble(BoundingBox::getY).min().orElse(0);
        double maxY = boxes.stream().mapToDouble(BoundingBox::getY).max().orElse(0);
        if (maxY - minY > ALIGNMENT_TOLERANCE + CROSS_AXIS_SPREAD) {
            return false;
        }
        List<BoundingBox> sorted = sortAlongAxis(boxes, true);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getX() < sorted.get(i - 1).right() - ALIGNMENT_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    boolean isColumn(List<BoundingBox> boxes) {
        double minX = boxes.stream().mapToDouble(BoundingBox::getX).min().orElse(0);
        double maxX = boxes.stream().mapToDouble(BoundingBox::getX).max().orElse(0);
        if (maxX - minX > ALIGNMENT_TOLERANCE + CROSS_AXIS_SPREAD) {
            return false;
        }
        List<BoundingBox> sorted = sortAlongAxis(boxes, false);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getY() < sorted.get(i - 1).bottom() - ALIGNMENT_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    boolean isStack(List<BoundingBox> boxes) {
        for (int i = 0; i < boxes.size(); i++) {
            for (int j = i + 1; j < boxes.size(); j++) {
                BoundingBox a = boxes.get(i);
                BoundingBox b = boxes.get(j);
                double smaller = Math.min(a.area(), b.area());
                if (smaller > 0 && overlapArea(a, b) > STACK_OVERLAP_RATIO * smaller) {
                    return true;
                }
            }
        }
        return false;
    }

    static double overlapArea(BoundingBox a, BoundingBox b) {
        double w = Math.min(a.right(), b.right()) - Math.max(a.getX(), b.getX());
        double h = Math.min(a.bottom(), b.bottom()) - Math.max(a.getY(), b.getY());
        return w > 0 && h > 0 ? w * h : 0;
    }

    static List<BoundingBox> sortAlongAxis(List<BoundingBox> boxes, boolean horizontal) {
        Comparator<BoundingBox> comparator = horizontal
                ? Comparator.comparingDouble(BoundingBox::getX)
                : Comparator.comparingDouble(BoundingBox::getY);
        return boxes.stream().sorted(comparator).toList();
    }

    private static List<BoundingBox> childBoxes(NormalizedNode node) {
        return node.getChildren().stream().map(NormalizedNode::getBoundingBox).toList();
    }
}

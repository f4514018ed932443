package com.designtool.lowering.recognize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.util.NamingUtil;

/**
 * Splits a sibling list into runs. A run of two or more contiguous siblings
 * that share a base name (or a component id) and the same shape becomes a
 * repeater; every other sibling is a run of one.
 */
public class RepeaterGrouper {

    public static final int MIN_REPEAT_COUNT = 2;

    public List<List<LayoutNode>> group(List<LayoutNode> siblings) {
        List<List<LayoutNode>> runs = new ArrayList<>();
        int i = 0;
        while (i < siblings.size()) {
            LayoutNode first = siblings.get(i);
            List<LayoutNode> run = new ArrayList<>();
            run.add(first);
            while (i + run.size() < siblings.size() && belongTogether(first, siblings.get(i + run.size()))) {
                run.add(siblings.get(i + run.size()));
            }
            runs.add(run);
            i += run.size();
        }
        return runs;
    }

    static boolean belongTogether(LayoutNode first, LayoutNode next) {
        String baseName = baseName(first);
        boolean sameName = baseName.length() > 2 && baseName.equals(baseName(next));
        String componentId = first.getProperties().getComponentId();
        boolean sameComponent = componentId != null
                && componentId.equals(next.getProperties().getComponentId());
        return (sameName || sameComponent) && sameShape(first, next);
    }

    static boolean sameShape(LayoutNode a, LayoutNode b) {
        if (a.getType() != b.getType() || a.getChildren().size() != b.getChildren().size()) {
            return false;
        }
        for (int i = 0; i < a.getChildren().size(); i++) {
            if (!Objects.equals(a.getChildren().get(i).getType(), b.getChildren().get(i).getType())) {
                return false;
            }
        }
        return true;
    }

    public static String baseName(LayoutNode node) {
        return NamingUtil.stripTrailingDigits(node.getName());
    }
}

package com.designtool.lowering.layout;

import com.designtool.lowering.model.layout.LayoutSizing;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.ParentContext;
import com.designtool.lowering.model.layout.Sizing;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.AxisSizingMode;
import com.designtool.lowering.model.raw.LayoutAlign;
import com.designtool.lowering.model.raw.LayoutMode;
import com.designtool.lowering.model.raw.NodeProperties;

/**
 * Resolves fixed / fill / hug per axis. Hugging comes from the node's own
 * auto-layout, filling from how the node sits in its parent; fill wins when
 * both apply to the same axis.
 */
public class SizingResolver {

    public LayoutSizing resolve(NormalizedNode node, LayoutType ownType, ParentContext parent) {
        NodeProperties props = node.getProperties();
        Sizing horizontal = Sizing.FIXED;
        Sizing vertical = Sizing.FIXED;

        boolean ownHorizontal = props.hasAutoLayout()
                ? props.getAutoLayout().getMode() == LayoutMode.HORIZONTAL
                : ownType == LayoutType.ROW;

        if (props.getPrimaryAxisSizingMode() == AxisSizingMode.AUTO) {
            if (ownHorizontal) {
                horizontal = Sizing.HUG;
            } else {
                vertical = Sizing.HUG;
            }
        }
        if (props.getCounterAxisSizingMode() == AxisSizingMode.AUTO) {
            if (ownHorizontal) {
                vertical = Sizing.HUG;
            } else {
                horizontal = Sizing.HUG;
            }
        }

        LayoutType parentType = parent.getType();
        if (props.getLayoutGrow() != null && props.getLayoutGrow() == 1) {
            if (parentType == LayoutType.ROW) {
                horizontal = Sizing.FILL;
            } else if (parentType == LayoutType.COLUMN) {
                vertical = Sizing.FILL;
            }
        }
        if (props.getLayoutAlign() == LayoutAlign.STRETCH) {
            if (parentType == LayoutType.ROW) {
                vertical = Sizing.FILL;
            } else if (parentType == LayoutType.COLUMN) {
                horizontal = Sizing.FILL;
            }
        }

        return new LayoutSizing(horizontal, vertical);
    }
}

package com.designtool.lowering.layout;

import com.designtool.lowering.model.layout.AbsolutePlacement;
import com.designtool.lowering.model.layout.Length;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.Constraints;

/**
 * Turns design-tool pinning constraints into offsets relative to the
 * immediate parent.
 */
public class ConstraintMapper {

    /**
     * @return the placement, or {@code null} when the node has no constraints
     */
    public AbsolutePlacement map(NormalizedNode node, BoundingBox parentBounds) {
        Constraints constraints = node.getProperties().getConstraints();
        if (constraints == null || parentBounds == null) {
            return null;
        }

        BoundingBox box = node.getBoundingBox();
        double relX = box.getX() - parentBounds.getX();
        double relY = box.getY() - parentBounds.getY();
        double parentWidth = parentBounds.getWidth();
        double parentHeight = parentBounds.getHeight();

        AbsolutePlacement.AbsolutePlacementBuilder placement = AbsolutePlacement.builder();

        if (constraints.getHorizontal() != null) {
            switch (constraints.getHorizontal()) {
                case LEFT, CENTER -> placement.left(Length.px(relX));
                case RIGHT -> placement.right(Length.px(parentWidth - (relX + box.getWidth())));
                case LEFT_RIGHT -> placement
                        .left(Length.px(relX))
                        .right(Length.px(parentWidth - (relX + box.getWidth())))
                        .width(Length.AUTO);
                case SCALE -> {
                    if (parentWidth > 0) {
                        placement.left(Length.percent(relX / parentWidth * 100))
                                .width(Length.percent(box.getWidth() / parentWidth * 100));
                    } else {
                        placement.left(Length.px(relX));
                    }
                }
            }
        }

        if (constraints.getVertical() != null) {
            switch (constraints.getVertical()) {
                case TOP, CENTER -> placement.top(Length.px(relY));
                case BOTTOM -> placement.bottom(Length.px(parentHeight - (relY + box.getHeight())));
                case TOP_BOTTOM -> placement
                        .top(Length.px(relY))
                        .bottom(Length.px(parentHeight - (relY + box.getHeight())))
                        .height(Length.AUTO);
                case SCALE -> {
                    if (parentHeight > 0) {
                        placement.top(Length.percent(relY / parentHeight * 100))
                                .height(Length.percent(box.getHeight() / parentHeight * 100));
                    } else {
                        placement.top(Length.px(relY));
                    }
                }
            }
        }

        return placement.build();
    }
}

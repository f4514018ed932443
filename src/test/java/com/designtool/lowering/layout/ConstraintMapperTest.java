package com.designtool.lowering.layout;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.model.layout.AbsolutePlacement;
import com.designtool.lowering.model.layout.Length;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.Constraints;
import com.designtool.lowering.model.raw.HorizontalConstraint;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.VerticalConstraint;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for constraint to placement mapping.
 */
class ConstraintMapperTest {

    private final ConstraintMapper mapper = new ConstraintMapper();

    @Test
    void testScaleYieldsPercentages() {
        NormalizedNode node = constrained(box(50, 100, 100, 100), HorizontalConstraint.SCALE, VerticalConstraint.SCALE);

        AbsolutePlacement placement = mapper.map(node, box(0, 0, 200, 400));

        assertThat(placement.getLeft()).hasToString("25%");
        assertThat(placement.getWidth()).hasToString("50%");
        assertThat(placement.getTop()).hasToString("25%");
        assertThat(placement.getHeight()).hasToString("25%");
    }

    @Test
    void testScaleRoundsToTwoDecimals() {
        NormalizedNode node = constrained(box(100, 0, 100, 10), HorizontalConstraint.SCALE, null);

        AbsolutePlacement placement = mapper.map(node, box(0, 0, 300, 10));

        assertThat(placement.getLeft()).isEqualTo(Length.percent(33.333333));
        assertThat(placement.getLeft()).hasToString("33.33%");
        assertThat(placement.getTop()).isNull();
    }

    @Test
    void testStretchPinsBothEdges() {
        NormalizedNode node = constrained(box(16, 100, 343, 44), HorizontalConstraint.LEFT_RIGHT,
                VerticalConstraint.TOP_BOTTOM);

        AbsolutePlacement placement = mapper.map(node, box(0, 0, 375, 812));

        assertThat(placement.getLeft()).isEqualTo(Length.px(16));
        assertThat(placement.getRight()).isEqualTo(Length.px(16));
        assertThat(placement.getWidth()).isEqualTo(Length.AUTO);
        assertThat(placement.getTop()).isEqualTo(Length.px(100));
        assertThat(placement.getBottom()).isEqualTo(Length.px(668));
        assertThat(placement.getHeight()).isEqualTo(Length.AUTO);
    }

    @Test
    void testOffsetsAreRelativeToImmediateParent() {
        NormalizedNode node = constrained(box(250, 260, 30, 20), HorizontalConstraint.RIGHT, VerticalConstraint.BOTTOM);

        AbsolutePlacement placement = mapper.map(node, box(100, 100, 200, 200));

        assertThat(placement.getRight()).isEqualTo(Length.px(20));
        assertThat(placement.getBottom()).isEqualTo(Length.px(20));
        assertThat(placement.getLeft()).isNull();
        assertThat(placement.getTop()).isNull();
    }

    @Test
    void testLeftTopAndCenter() {
        NormalizedNode node = constrained(box(120, 140, 30, 20), HorizontalConstraint.CENTER, VerticalConstraint.TOP);

        AbsolutePlacement placement = mapper.map(node, box(100, 100, 200, 200));

        assertThat(placement.getLeft()).isEqualTo(Length.px(20));
        assertThat(placement.getTop()).isEqualTo(Length.px(40));
    }

    @Test
    void testNoConstraintsNoPlacement() {
        assertThat(mapper.map(normalized("1", box(0, 0, 10, 10)), box(0, 0, 100, 100))).isNull();
    }

    private static NormalizedNode constrained(BoundingBox box,
                                              HorizontalConstraint horizontal, VerticalConstraint vertical) {
        NodeProperties props = NodeProperties.builder().constraints(new Constraints(horizontal, vertical)).build();
        return normalized("c", box, props);
    }
}

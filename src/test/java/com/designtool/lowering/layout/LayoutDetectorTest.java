package com.designtool.lowering.layout;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.AutoLayout;
import com.designtool.lowering.model.raw.LayoutMode;
import com.designtool.lowering.model.raw.NodeProperties;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for layout type detection and gap calculation.
 */
class LayoutDetectorTest {

    private final LayoutDetector detector = new LayoutDetector();

    @Test
    void testEvenlySpacedChildrenFormRow() {
        NormalizedNode row = normalized("1", box(0, 0, 170, 50),
                normalized("2", box(0, 0, 50, 50)),
                normalized("3", box(60, 0, 50, 50)),
                normalized("4", box(120, 0, 50, 50)));

        assertThat(detector.detect(row)).isEqualTo(LayoutType.ROW);
        assertThat(detector.calculateGap(row, LayoutType.ROW)).isEqualTo(10);
    }

    @Test
    void testVerticallyStackedChildrenFormColumn() {
        NormalizedNode column = normalized("1", box(0, 0, 100, 110),
                normalized("2", box(0, 0, 100, 30)),
                normalized("3", box(0, 40, 100, 30)),
                normalized("4", box(0, 80, 100, 30)));

        assertThat(detector.detect(column)).isEqualTo(LayoutType.COLUMN);
        assertThat(detector.calculateGap(column, LayoutType.COLUMN)).isEqualTo(10);
    }

    @Test
    void testOverlappingChildrenFormStack() {
        NormalizedNode card = normalized("1", box(0, 0, 100, 100),
                normalized("2", box(0, 0, 100, 100)),
                normalized("3", box(10, 10, 80, 20)));

        assertThat(detector.detect(card)).isEqualTo(LayoutType.STACK);
        assertThat(detector.calculateGap(card, LayoutType.STACK)).isZero();
    }

    @Test
    void testExplicitAutoLayoutWinsOverGeometry() {
        NodeProperties props = NodeProperties.builder()
                .autoLayout(AutoLayout.builder().mode(LayoutMode.HORIZONTAL).gap(12.0).build())
                .build();
        NormalizedNode node = normalized("1", box(0, 0, 100, 200), props,
                normalized("2", box(0, 0, 100, 50)),
                normalized("3", box(0, 60, 100, 50)));

        assertThat(detector.detect(node)).isEqualTo(LayoutType.ROW);
        assertThat(detector.calculateGap(node, LayoutType.ROW)).isEqualTo(12);
    }

    @Test
    void testChildCountEdgeCases() {
        assertThat(detector.detect(normalized("1", box(0, 0, 10, 10)))).isEqualTo(LayoutType.ABSOLUTE);
        assertThat(detector.detect(normalized("1", box(0, 0, 100, 100), normalized("2", box(10, 10, 20, 20)))))
                .isEqualTo(LayoutType.COLUMN);
    }

    @Test
    void testScatteredChildrenFallBackToAbsolute() {
        NormalizedNode node = normalized("1", box(0, 0, 375, 400),
                normalized("2", box(0, 0, 50, 50)),
                normalized("3", box(200, 300, 50, 50)),
                normalized("4", box(100, 150, 50, 50)));

        assertThat(detector.detect(node)).isEqualTo(LayoutType.ABSOLUTE);
    }

    @Test
    void testGapAveragesOnlyPositiveGaps() {
        NormalizedNode row = normalized("1", box(0, 0, 160, 50),
                normalized("2", box(0, 0, 50, 50)),
                normalized("3", box(50, 0, 50, 50)),
                normalized("4", box(110, 0, 50, 50)));

        assertThat(detector.detect(row)).isEqualTo(LayoutType.ROW);
        assertThat(detector.calculateGap(row, LayoutType.ROW)).isEqualTo(10);
    }

    @Test
    void testOverlapArea() {
        assertThat(LayoutDetector.overlapArea(box(0, 0, 10, 10), box(5, 5, 10, 10))).isEqualTo(25);
        assertThat(LayoutDetector.overlapArea(box(0, 0, 10, 10), box(10, 0, 10, 10))).isZero();
    }
}

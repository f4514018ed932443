package com.designtool.lowering.layout;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.model.layout.LayoutSizing;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.ParentContext;
import com.designtool.lowering.model.layout.Sizing;
import com.designtool.lowering.model.raw.AutoLayout;
import com.designtool.lowering.model.raw.AxisSizingMode;
import com.designtool.lowering.model.raw.LayoutAlign;
import com.designtool.lowering.model.raw.LayoutMode;
import com.designtool.lowering.model.raw.NodeProperties;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for fixed / fill / hug resolution.
 */
class SizingResolverTest {

    private final SizingResolver resolver = new SizingResolver();

    @Test
    void testDefaultsToFixed() {
        LayoutSizing sizing = resolver.resolve(normalized("1", box(0, 0, 10, 10)), LayoutType.ABSOLUTE,
                ParentContext.ROOT);

        assertThat(sizing).isEqualTo(LayoutSizing.FIXED);
    }

    @Test
    void testAutoSizingModesHug() {
        NodeProperties props = NodeProperties.builder()
                .autoLayout(AutoLayout.builder().mode(LayoutMode.HORIZONTAL).build())
                .primaryAxisSizingMode(AxisSizingMode.AUTO)
                .counterAxisSizingMode(AxisSizingMode.FIXED)
                .build();

        LayoutSizing sizing = resolver.resolve(normalized("1", box(0, 0, 10, 10), props), LayoutType.ROW,
                ParentContext.ROOT);

        assertThat(sizing.getHorizontal()).isEqualTo(Sizing.HUG);
        assertThat(sizing.getVertical()).isEqualTo(Sizing.FIXED);
    }

    @Test
    void testGrowFillsParentMainAxis() {
        NodeProperties props = NodeProperties.builder().layoutGrow(1.0).build();

        LayoutSizing inRow = resolver.resolve(normalized("1", box(0, 0, 10, 10), props), LayoutType.ABSOLUTE,
                new ParentContext(LayoutType.ROW, box(0, 0, 100, 10)));
        LayoutSizing inColumn = resolver.resolve(normalized("1", box(0, 0, 10, 10), props), LayoutType.ABSOLUTE,
                new ParentContext(LayoutType.COLUMN, box(0, 0, 10, 100)));

        assertThat(inRow).isEqualTo(new LayoutSizing(Sizing.FILL, Sizing.FIXED));
        assertThat(inColumn).isEqualTo(new LayoutSizing(Sizing.FIXED, Sizing.FILL));
    }

    @Test
    void testStretchFillsParentCrossAxisAndWinsOverHug() {
        NodeProperties props = NodeProperties.builder()
                .autoLayout(AutoLayout.builder().mode(LayoutMode.HORIZONTAL).build())
                .counterAxisSizingMode(AxisSizingMode.AUTO)
                .layoutAlign(LayoutAlign.STRETCH)
                .build();

        LayoutSizing sizing = resolver.resolve(normalized("1", box(0, 0, 10, 10), props), LayoutType.ROW,
                new ParentContext(LayoutType.ROW, box(0, 0, 100, 40)));

        assertThat(sizing.getVertical()).isEqualTo(Sizing.FILL);
    }

    @Test
    void testGrowIgnoredInsideAbsoluteParent() {
        NodeProperties props = NodeProperties.builder().layoutGrow(1.0).build();

        LayoutSizing sizing = resolver.resolve(normalized("1", box(0, 0, 10, 10), props), LayoutType.ABSOLUTE,
                new ParentContext(LayoutType.ABSOLUTE, box(0, 0, 100, 100)));

        assertThat(sizing).isEqualTo(LayoutSizing.FIXED);
    }
}

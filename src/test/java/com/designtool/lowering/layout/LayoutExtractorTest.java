package com.designtool.lowering.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.designtool.lowering.model.layout.CrossAlign;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.MainAlign;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.AutoLayout;
import com.designtool.lowering.model.raw.LayoutMode;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.Padding;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for padding and alignment resolution.
 */
class LayoutExtractorTest {

    private final LayoutExtractor extractor = new LayoutExtractor();

    @Test
    void testInferPaddingFromChildUnion() {
        NormalizedNode node = normalized("1", box(0, 0, 100, 100), normalized("2", box(10, 20, 80, 60)));

        assertThat(extractor.resolvePadding(node)).isEqualTo(new Padding(20, 10, 20, 10));
    }

    @Test
    void testInferPaddingClampsOverflowingChildren() {
        NormalizedNode node = normalized("1", box(0, 0, 100, 100), normalized("2", box(-5, 10, 110, 80)));

        assertThat(extractor.resolvePadding(node)).isEqualTo(new Padding(10, 0, 10, 0));
    }

    @Test
    void testChildlessNodeHasZeroPadding() {
        assertThat(extractor.resolvePadding(normalized("1", box(0, 0, 100, 100)))).isEqualTo(Padding.ZERO);
    }

    @Test
    void testExplicitPaddingIsUsedAsIs() {
        NodeProperties props = NodeProperties.builder()
                .autoLayout(AutoLayout.builder().mode(LayoutMode.VERTICAL).padding(new Padding(8, 16, 8, 16)).build())
                .build();
        NormalizedNode node = normalized("1", box(0, 0, 100, 100), props, normalized("2", box(0, 0, 100, 100)));

        assertThat(extractor.resolvePadding(node)).isEqualTo(new Padding(8, 16, 8, 16));
    }

    @Test
    void testMainAxisInference() {
        assertThat(mainAlignOfRow(0, 50)).isEqualTo(MainAlign.START);
        assertThat(mainAlignOfRow(110, 150)).isEqualTo(MainAlign.CENTER);
        assertThat(mainAlignOfRow(205, 255)).isEqualTo(MainAlign.END);
    }

    @Test
    void testCrossAxisInference() {
        assertThat(crossAlignOfRow(0)).isEqualTo(CrossAlign.START);
        assertThat(crossAlignOfRow(40)).isEqualTo(CrossAlign.CENTER);
        assertThat(crossAlignOfRow(80)).isEqualTo(CrossAlign.END);
    }

    @Test
    void testAbsoluteLayoutAlignsToStart() {
        NormalizedNode node = normalized("1", box(0, 0, 300, 100), normalized("2", box(130, 40, 40, 20)));

        assertThat(extractor.resolveMainAlign(node, LayoutType.ABSOLUTE)).isEqualTo(MainAlign.START);
        assertThat(extractor.resolveCrossAlign(node, LayoutType.ABSOLUTE)).isEqualTo(CrossAlign.START);
    }

    @ParameterizedTest
    @CsvSource({
            "MIN, START",
            "MAX, END",
            "CENTER, CENTER",
            "SPACE_BETWEEN, SPACE_BETWEEN",
            "SPACE_AROUND, SPACE_AROUND",
            "BASELINE, START"
    })
    void testMainAlignTable(String value, MainAlign expected) {
        assertThat(LayoutExtractor.mapMainAlign(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "MIN, START",
            "MAX, END",
            "CENTER, CENTER",
            "BASELINE, BASELINE",
            "STRETCH, STRETCH",
            "SPACE_BETWEEN, START"
    })
    void testCrossAlignTable(String value, CrossAlign expected) {
        assertThat(LayoutExtractor.mapCrossAlign(value)).isEqualTo(expected);
    }

    @Test
    void testMissingExplicitAlignDefaultsToStart() {
        assertThat(LayoutExtractor.mapMainAlign(null)).isEqualTo(MainAlign.START);
        assertThat(LayoutExtractor.mapCrossAlign(null)).isEqualTo(CrossAlign.START);
    }

    private MainAlign mainAlignOfRow(double firstX, double secondX) {
        NormalizedNode row = normalized("1", box(0, 0, 300, 50),
                normalized("2", box(firstX, 0, 40, 50)),
                normalized("3", box(secondX, 0, 40, 50)));
        return extractor.resolveMainAlign(row, LayoutType.ROW);
    }

    private CrossAlign crossAlignOfRow(double childY) {
        NormalizedNode row = normalized("1", box(0, 0, 300, 100),
                normalized("2", box(0, childY, 40, 20)),
                normalized("3", box(50, childY, 40, 20)));
        return extractor.resolveCrossAlign(row, LayoutType.ROW);
    }
}

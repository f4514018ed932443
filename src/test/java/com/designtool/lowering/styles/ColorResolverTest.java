package com.designtool.lowering.styles;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.designtool.lowering.model.raw.RgbaColor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for effective colour formatting.
 */
class ColorResolverTest {

    @ParameterizedTest
    @CsvSource({
            "255, 255, 255, 1.0, 1.0, #FFFFFF",
            "0, 122, 255, 1.0, 1.0, #007AFF",
            "0, 0, 0, 1.0, 0.5, #00000080",
            "0, 0, 0, 0.5, 0.5, #00000040",
            "16, 32, 48, 0.996, 1.0, #102030",
            "300, -4, 10, 1.0, 1.0, #FF000A"
    })
    void testResolveEffectiveColor(int r, int g, int b, double a, double opacity, String expected) {
        assertThat(ColorResolver.resolveEffectiveColor(new RgbaColor(r, g, b, a), opacity)).isEqualTo(expected);
    }
}

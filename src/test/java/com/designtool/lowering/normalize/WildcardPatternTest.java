package com.designtool.lowering.normalize;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for wildcard name matching.
 */
class WildcardPatternTest {

    @ParameterizedTest
    @CsvSource({
            "*annotation*, Design Annotation 2, true",
            "*annotation*, ANNOTATIONS, true",
            "*annotation*, Annotate, false",
            "*-guide, grid-guide, true",
            "*-guide, grid-guide copy, false",
            "Status Bar, status bar, true",
            "Status Bar, Status Bar Dark, false",
            "icon.*, icon.png, true",
            "icon.*, iconXpng, false",
            "a*b*c, aXXbYYc, true",
            "a*b*c, acb, false"
    })
    void testMatches(String pattern, String name, boolean expected) {
        assertThat(WildcardPattern.compile(pattern).matches(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"*", "**", "*guide*"})
    void testNullNameNeverMatches(String pattern) {
        assertThat(WildcardPattern.compile(pattern).matches(null)).isFalse();
    }
}

package com.designtool.lowering.model.style;

import java.util.Map;

import lombok.Value;

/**
 * Deduplicated styles keyed by style reference, plus the tokens derived from them.
 */
@Value
public class StylesBundle {
    Map<String, ExtractedStyle> styles;
    DesignTokens tokens;

    public boolean contains(String styleRef) {
        return styles.containsKey(styleRef);
    }
}

package com.designtool.lowering.styles;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.Padding;
import com.designtool.lowering.model.style.DesignTokens;
import com.designtool.lowering.model.style.ExtractedStyle;
import com.designtool.lowering.model.style.ShadowStyle;
import com.designtool.lowering.model.style.TypographyStyle;
import com.designtool.lowering.model.style.TypographyToken;

/**
 * Collects distinct colours, spacings, radii, text styles and shadows into
 * numbered tokens. Colours, typography and shadows are numbered in first-seen
 * order; spacing and radii ascending.
 */
public class TokenCollector {

    public DesignTokens collect(Map<String, ExtractedStyle> styles, LayoutNode layoutTree) {
        Set<String> colors = new LinkedHashSet<>();
        Set<Double> radii = new TreeSet<>();
        Map<String, TypographyToken> typography = new LinkedHashMap<>();
        Set<ShadowStyle> shadows = new LinkedHashSet<>();

        for (ExtractedStyle style : styles.values()) {
            addIfPresent(colors, style.getBackgroundColor());
            if (style.getBackgroundGradient() != null) {
                style.getBackgroundGradient().getColors().forEach(c -> addIfPresent(colors, c));
            }
            addIfPresent(colors, style.getBorderColor());
            if (style.getShadow() != null) {
                addIfPresent(colors, style.getShadow().getColor());
                shadows.add(style.getShadow());
            }
            TypographyStyle text = style.getTypography();
            if (text != null) {
                addIfPresent(colors, text.getColor());
                typography.putIfAbsent(text.getFontFamily() + "-" + text.getFontSize() + "-" + text.getFontWeight(),
                        new TypographyToken(text.getFontFamily(), text.getFontSize(), text.getFontWeight(),
                                text.getLineHeight()));
            }
            addPositive(radii, style.getBorderRadius());
            CornerRadius corners = style.getBorderRadii();
            if (corners != null) {
                for (double r : List.of(corners.getTopLeft(), corners.getTopRight(),
                        corners.getBottomRight(), corners.getBottomLeft())) {
                    addPositive(radii, r);
                }
            }
        }

        Set<Double> spacing = new TreeSet<>();
        collectSpacing(layoutTree, spacing);

        return DesignTokens.builder()
                .colors(number("color_", colors))
                .spacing(number("spacing_", spacing))
                .radii(number("radius_", radii))
                .typography(number("text_", typography.values()))
                .shadows(number("shadow_", shadows))
                .build();
    }

    private static void collectSpacing(LayoutNode node, Set<Double> spacing) {
        LayoutMeta layout = node.getLayout();
        if (layout != null) {
            addPositive(spacing, layout.getGap());
            Padding padding = layout.getPadding();
            if (padding != null) {
                addPositive(spacing, padding.getTop());
                addPositive(spacing, padding.getRight());
                addPositive(spacing, padding.getBottom());
                addPositive(spacing, padding.getLeft());
            }
        }
        for (LayoutNode child : node.getChildren()) {
            collectSpacing(child, spacing);
        }
    }

    private static <T> Map<String, T> number(String prefix, Iterable<T> values) {
        Map<String, T> tokens = new LinkedHashMap<>();
        int index = 0;
        for (T value : values) {
            tokens.put(prefix + index++, value);
        }
        return tokens;
    }

    private static void addIfPresent(Set<String> set, String value) {
        if (value != null) {
            set.add(value);
        }
    }

    private static void addPositive(Set<Double> set, Double value) {
        if (value != null && value > 0) {
            set.add(value);
        }
    }
}

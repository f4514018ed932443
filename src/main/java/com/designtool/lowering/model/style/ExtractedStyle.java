package com.designtool.lowering.model.style;

import java.util.SortedMap;
import java.util.TreeMap;

import com.designtool.lowering.model.layout.Length;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.Padding;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;

/**
 * Visual properties of one IR node, ready for a style emitter. Unset properties
 * are {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedStyle {
    String backgroundColor;
    GradientStyle backgroundGradient;
    String borderColor;
    Double borderWidth;
    Double borderRadius;
    CornerRadius borderRadii;
    ShadowStyle shadow;
    Double blur;
    Double opacity;
    TypographyStyle typography;

    Length width;
    Length height;
    String position;
    Length left;
    Length right;
    Length top;
    Length bottom;

    String flexDirection;
    String justifyContent;
    String alignItems;
    Double gap;
    Padding padding;
    Integer flex;
    String overflow;

    /**
     * Flattened, key-sorted view of every set property. Two styles with equal
     * maps render identically.
     */
    @JsonIgnore
    public SortedMap<String, String> toPropertyMap() {
        SortedMap<String, String> map = new TreeMap<>();
        put(map, "backgroundColor", backgroundColor);
        if (backgroundGradient != null) {
            put(map, "backgroundGradient.type", backgroundGradient.getType());
            put(map, "backgroundGradient.colors", backgroundGradient.getColors());
            put(map, "backgroundGradient.positions", backgroundGradient.getPositions());
            put(map, "backgroundGradient.angle", backgroundGradient.getAngle());
        }
        put(map, "borderColor", borderColor);
        put(map, "borderWidth", borderWidth);
        put(map, "borderRadius", borderRadius);
        if (borderRadii != null) {
            put(map, "borderRadii", borderRadii.getTopLeft() + " " + borderRadii.getTopRight() + " "
                    + borderRadii.getBottomRight() + " " + borderRadii.getBottomLeft());
        }
        if (shadow != null) {
            put(map, "shadow.color", shadow.getColor());
            put(map, "shadow.offsetX", shadow.getOffsetX());
            put(map, "shadow.offsetY", shadow.getOffsetY());
            put(map, "shadow.blur", shadow.getBlur());
            put(map, "shadow.spread", shadow.getSpread());
            put(map, "shadow.inset", shadow.isInset());
        }
        put(map, "blur", blur);
        put(map, "opacity", opacity);
        if (typography != null) {
            put(map, "typography.fontFamily", typography.getFontFamily());
            put(map, "typography.fontSize", typography.getFontSize());
            put(map, "typography.fontWeight", typography.getFontWeight());
            put(map, "typography.lineHeight", typography.getLineHeight());
            put(map, "typography.letterSpacing", typography.getLetterSpacing());
            put(map, "typography.textAlign", typography.getTextAlign());
            put(map, "typography.textDecoration", typography.getTextDecoration());
            put(map, "typography.textCase", typography.getTextCase());
            put(map, "typography.color", typography.getColor());
        }
        put(map, "width", width);
        put(map, "height", height);
        put(map, "position", position);
        put(map, "left", left);
        put(map, "right", right);
        put(map, "top", top);
        put(map, "bottom", bottom);
        put(map, "flexDirection", flexDirection);
        put(map, "justifyContent", justifyContent);
        put(map, "alignItems", alignItems);
        put(map, "gap", gap);
        if (padding != null) {
            put(map, "padding", padding.getTop() + " " + padding.getRight() + " "
                    + padding.getBottom() + " " + padding.getLeft());
        }
        put(map, "flex", flex);
        put(map, "overflow", overflow);
        return map;
    }

    private static void put(SortedMap<String, String> map, String key, Object value) {
        if (value != null) {
            map.put(key, String.valueOf(value));
        }
    }
}

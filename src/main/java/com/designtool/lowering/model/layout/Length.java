package com.designtool.lowering.model.layout;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.EqualsAndHashCode;

/**
 * A CSS-like length: either a number of pixels or a keyword / percentage string.
 */
@EqualsAndHashCode
public final class Length {
    public static final Length AUTO = new Length(null, "auto");

    private final Double pixels;
    private final String keyword;

    private Length(Double pixels, String keyword) {
        this.pixels = pixels;
        this.keyword = keyword;
    }

    public static Length px(double pixels) {
        return new Length(pixels, null);
    }

    /**
     * Percentage rounded to two decimals with trailing zeros stripped, e.g. {@code "25%"} or {@code "33.33%"}.
     */
    public static Length percent(double percent) {
        BigDecimal rounded = BigDecimal.valueOf(percent).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return new Length(null, rounded.toPlainString() + "%");
    }

    public boolean isPixels() {
        return pixels != null;
    }

    public double getPixels() {
        if (pixels == null) {
            throw new IllegalStateException("Length " + keyword + " is not a pixel value");
        }
        return pixels;
    }

    @JsonValue
    public Object toJson() {
        return pixels != null ? pixels : keyword;
    }

    @Override
    public String toString() {
        return pixels != null ? String.valueOf(pixels) : keyword;
    }
}

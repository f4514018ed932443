package com.designtool.lowering.styles;

import com.designtool.lowering.model.raw.RgbaColor;

/**
 * Formats design colours as upper-case hex strings.
 */
public class ColorResolver {

    static final double OPAQUE_THRESHOLD = 0.995;

    private ColorResolver() {
        // Utility class
    }

    /**
     * Multiplies the colour alpha by the paint opacity. Effectively opaque
     * colours render as {@code #RRGGBB}, anything else as {@code #RRGGBBAA}.
     */
    public static String resolveEffectiveColor(RgbaColor color, double opacity) {
        double alpha = color.getA() * opacity;
        String rgb = String.format("#%02X%02X%02X", clamp(color.getR()), clamp(color.getG()), clamp(color.getB()));
        if (alpha >= OPAQUE_THRESHOLD) {
            return rgb;
        }
        return rgb + String.format("%02X", clamp((int) Math.round(alpha * 255)));
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }
}

package com.designtool.lowering.model.raw;

/**
 * A paint applied to the node's background (or text glyphs for TEXT nodes).
 */
public sealed interface Fill permits SolidFill, GradientFill, ImageFill {

    /**
     * Paint opacity in 0-1, independent of the colour's own alpha.
     */
    double getOpacity();
}

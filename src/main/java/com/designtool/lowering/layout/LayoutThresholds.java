package com.designtool.lowering.layout;

/**
 * Pixel tolerances used by layout inference. The values were tuned by hand
 * against exported mobile screens and are expected to be recalibrated.
 */
public final class LayoutThresholds {

    /** Tolerance when comparing edges of neighbouring children. */
    public static final double ALIGNMENT_TOLERANCE = 2;

    /** Extra cross-axis spread allowed for children of a row or column. */
    public static final double CROSS_AXIS_SPREAD = 20;

    /** Overlap, as a share of the smaller child, that makes two children stacked. */
    public static final double STACK_OVERLAP_RATIO = 0.5;

    /** Leading and trailing offsets closer than this are treated as centred. */
    public static final double CENTER_TOLERANCE = 10;

    /** Trailing offset below which children count as end aligned. */
    public static final double END_TRAILING_MAX = 10;

    /** Leading offset an end-aligned run must exceed. */
    public static final double END_LEADING_MIN = 20;

    private LayoutThresholds() {
    }
}

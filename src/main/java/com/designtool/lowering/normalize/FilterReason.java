package com.designtool.lowering.normalize;

/**
 * Why a node was dropped during normalization.
 */
public enum FilterReason {
    EXCLUDED,
    HIDDEN,
    STATUS_BAR,
    HOME_INDICATOR,
    OS_COMPONENT,
    ANNOTATION,
    MEASUREMENT,
    PATTERN_MATCH
}

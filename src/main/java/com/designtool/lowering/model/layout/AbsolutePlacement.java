package com.designtool.lowering.model.layout;

import lombok.Builder;
import lombok.Value;

/**
 * Offsets of an absolutely positioned node relative to its immediate parent.
 * Unset edges are {@code null}.
 */
@Value
@Builder
public class AbsolutePlacement {
    Length left;
    Length right;
    Length top;
    Length bottom;
    Length width;
    Length height;
}

package com.designtool.lowering.model.layout;

import com.designtool.lowering.model.raw.Padding;

import lombok.Builder;
import lombok.Value;

/**
 * Layout resolved for one node: how it places its children and how it sizes
 * itself inside its parent.
 */
@Value
@Builder(toBuilder = true)
public class LayoutMeta {
    LayoutType type;
    double gap;
    Padding padding;
    MainAlign mainAlign;
    CrossAlign crossAlign;
    LayoutSizing sizing;
    /** {@code null} when content does not scroll or clip. */
    Overflow overflow;

    public static LayoutMeta emptyColumn() {
        return LayoutMeta.builder()
                .type(LayoutType.COLUMN)
                .gap(0)
                .padding(Padding.ZERO)
                .mainAlign(MainAlign.START)
                .crossAlign(CrossAlign.START)
                .sizing(LayoutSizing.FIXED)
                .build();
    }
}

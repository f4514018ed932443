package com.designtool.lowering.model.raw;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Typography {
    String fontFamily;
    double fontSize;
    int fontWeight;
    Double lineHeight;
    Double letterSpacing;
    String textAlign;
    String textDecoration;
    String textCase;
}

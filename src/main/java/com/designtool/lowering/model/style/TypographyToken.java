package com.designtool.lowering.model.style;

import lombok.Value;

@Value
public class TypographyToken {
    String fontFamily;
    double fontSize;
    int fontWeight;
    Double lineHeight;
}

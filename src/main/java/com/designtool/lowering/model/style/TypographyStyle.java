package com.designtool.lowering.model.style;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TypographyStyle {
    String fontFamily;
    double fontSize;
    int fontWeight;
    Double lineHeight;
    Double letterSpacing;
    String textAlign;
    String textDecoration;
    String textCase;
    String color;
}

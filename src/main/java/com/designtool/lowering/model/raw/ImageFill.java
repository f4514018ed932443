package com.designtool.lowering.model.raw;

import lombok.Value;

@Value
public class ImageFill implements Fill {
    String imageRef;
    String scaleMode;
    double opacity;
}

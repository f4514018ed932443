package com.designtool.lowering.model.raw;

import lombok.Value;

@Value
public class Constraints {
    HorizontalConstraint horizontal;
    VerticalConstraint vertical;
}

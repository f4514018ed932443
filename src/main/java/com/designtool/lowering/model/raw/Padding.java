package com.designtool.lowering.model.raw;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Value;

@Value
public class Padding {
    public static final Padding ZERO = new Padding(0, 0, 0, 0);

    double top;
    double right;
    double bottom;
    double left;

    @JsonIgnore
    public boolean isZero() {
        return top == 0 && right == 0 && bottom == 0 && left == 0;
    }
}

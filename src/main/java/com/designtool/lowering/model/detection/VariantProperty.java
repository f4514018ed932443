package com.designtool.lowering.model.detection;

import java.util.List;

import lombok.Value;

@Value
public class VariantProperty {
    String name;
    List<String> values;
    String defaultValue;
}

package com.designtool.lowering.model.detection;

import java.util.List;

import lombok.Value;

@Value
public class VariantDetection {
    String componentSetId;
    String componentName;
    List<VariantProperty> properties;
    List<StateStyle> states;
}

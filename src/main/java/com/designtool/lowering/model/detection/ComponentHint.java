package com.designtool.lowering.model.detection;

import java.util.List;
import java.util.Map;

import lombok.Value;

/**
 * Structurally identical subtrees found across the screen, with the text
 * values that differ between instances.
 */
@Value
public class ComponentHint {
    String componentName;
    List<String> instanceIds;
    Map<String, List<String>> propsVariations;
}

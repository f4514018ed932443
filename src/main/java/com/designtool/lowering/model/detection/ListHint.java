package com.designtool.lowering.model.detection;

import java.util.List;

import lombok.Value;

/**
 * A container whose children are interchangeable list items.
 */
@Value
public class ListHint {
    String containerId;
    List<String> itemIds;
    ListOrientation orientation;
    String itemType;
}

package com.designtool.lowering.model.detection;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Device chrome found on a screen and the insets it implies.
 */
@Value
@Builder
public class SafeAreaResult {
    SafeAreaInsets insets;
    boolean hasSafeAreaLayout;
    /** Chrome node id to its kind, in discovery order. */
    Map<String, ChromeElement> elements;
    /** Every node id inside detected chrome, to be dropped by the normalizer. */
    List<String> excludeIds;

    public static SafeAreaResult none() {
        return SafeAreaResult.builder()
                .insets(SafeAreaInsets.ZERO)
                .hasSafeAreaLayout(false)
                .elements(Map.of())
                .excludeIds(List.of())
                .build();
    }
}

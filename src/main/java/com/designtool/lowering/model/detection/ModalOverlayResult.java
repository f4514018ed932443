package com.designtool.lowering.model.detection;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModalOverlayResult {
    boolean hasModalOverlay;
    ModalType modalType;
    String overlayId;
    String contentId;
    String contentName;
    /** Siblings of the overlay that render the dimmed screen behind it. */
    List<String> backgroundIds;

    public static ModalOverlayResult none() {
        return ModalOverlayResult.builder()
                .hasModalOverlay(false)
                .backgroundIds(List.of())
                .build();
    }
}

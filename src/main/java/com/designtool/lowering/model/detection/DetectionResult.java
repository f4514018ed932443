package com.designtool.lowering.model.detection;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory findings about the screen. Detectors never modify the IR.
 */
@Value
@Builder(toBuilder = true)
public class DetectionResult {
    @Builder.Default
    List<ListHint> lists = List.of();
    @Builder.Default
    List<ComponentHint> components = List.of();
    @Builder.Default
    List<VariantDetection> variants = List.of();
    @Builder.Default
    ModalOverlayResult modalOverlay = ModalOverlayResult.none();
    @Builder.Default
    SafeAreaResult safeArea = SafeAreaResult.none();

    public static DetectionResult empty() {
        return DetectionResult.builder().build();
    }
}

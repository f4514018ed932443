package com.designtool.lowering.detection;

import com.designtool.lowering.model.detection.DetectionResult;
import com.designtool.lowering.model.ir.IrNode;

/**
 * Runs the IR-level detectors. Raw-tree detectors (modal overlay, variants,
 * safe area) run earlier in the pipeline and are merged into the same result.
 */
public class PatternDetectors {

    private final ListDetector listDetector;
    private final RepetitionDetector repetitionDetector;

    public PatternDetectors() {
        this(new ListDetector(), new RepetitionDetector());
    }

    public PatternDetectors(ListDetector listDetector, RepetitionDetector repetitionDetector) {
        this.listDetector = listDetector;
        this.repetitionDetector = repetitionDetector;
    }

    public DetectionResult detect(IrNode root) {
        return DetectionResult.builder()
                .lists(listDetector.detect(root))
                .components(repetitionDetector.detect(root))
                .build();
    }
}

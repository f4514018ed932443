package com.designtool.lowering.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.detection.ModalOverlayDetector;
import com.designtool.lowering.detection.PatternDetectors;
import com.designtool.lowering.detection.SafeAreaDetector;
import com.designtool.lowering.detection.VariantStateDetector;
import com.designtool.lowering.layout.LayoutEngine;
import com.designtool.lowering.model.detection.DetectionResult;
import com.designtool.lowering.model.detection.ModalOverlayResult;
import com.designtool.lowering.model.detection.SafeAreaResult;
import com.designtool.lowering.model.detection.VariantDetection;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.layout.ParentContext;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.model.style.StylesBundle;
import com.designtool.lowering.normalize.Normalizer;
import com.designtool.lowering.recognize.SemanticClassifier;
import com.designtool.lowering.styles.StyleExtractor;

/**
 * Lowers one raw design-tool tree into IR, styles and detection results.
 *
 * Stages run strictly in order, each consuming only the previous stage's
 * output: raw detectors, normalize, layout, classify, styles, IR detectors.
 * Instances hold no per-run state and may be shared between threads.
 */
public class LoweringPipeline {
    private static final Logger log = LoggerFactory.getLogger(LoweringPipeline.class);

    private final SafeAreaDetector safeAreaDetector;
    private final ModalOverlayDetector modalOverlayDetector;
    private final VariantStateDetector variantStateDetector;
    private final Normalizer normalizer;
    private final LayoutEngine layoutEngine;
    private final SemanticClassifier classifier;
    private final StyleExtractor styleExtractor;
    private final PatternDetectors patternDetectors;

    public LoweringPipeline() {
        this(new SafeAreaDetector(), new ModalOverlayDetector(), new VariantStateDetector(), new Normalizer(),
                new LayoutEngine(), new SemanticClassifier(), new StyleExtractor(), new PatternDetectors());
    }

    public LoweringPipeline(SafeAreaDetector safeAreaDetector, ModalOverlayDetector modalOverlayDetector,
                            VariantStateDetector variantStateDetector, Normalizer normalizer,
                            LayoutEngine layoutEngine, SemanticClassifier classifier,
                            StyleExtractor styleExtractor, PatternDetectors patternDetectors) {
        this.safeAreaDetector = safeAreaDetector;
        this.modalOverlayDetector = modalOverlayDetector;
        this.variantStateDetector = variantStateDetector;
        this.normalizer = normalizer;
        this.layoutEngine = layoutEngine;
        this.classifier = classifier;
        this.styleExtractor = styleExtractor;
        this.patternDetectors = patternDetectors;
    }

    public LoweringResult lower(RawNode input) {
        return lower(input, PipelineOptions.defaults());
    }

    public LoweringResult lower(RawNode input, PipelineOptions options) {
        log.info("Lowering node {} '{}'", input.getId(), input.getName());
        PipelineDiagnostics diagnostics = new PipelineDiagnostics();

        // Step 1: raw-tree detectors
        SafeAreaResult safeArea = options.isDetectSafeArea()
                ? safeAreaDetector.detect(input)
                : SafeAreaResult.none();
        ModalOverlayResult modal = options.isDetectModalOverlay()
                ? modalOverlayDetector.detect(input)
                : ModalOverlayResult.none();
        List<VariantDetection> variants = variantStateDetector.detect(input);

        RawNode target = input;
        if (modal.isHasModalOverlay()) {
            target = ModalOverlayDetector.findById(input, modal.getContentId()).orElse(input);
            diagnostics.getInfos().add("Lowered modal content '" + target.getName() + "' instead of the full screen");
        }
        if (!safeArea.getElements().isEmpty()) {
            diagnostics.getInfos().add("Excluded " + safeArea.getElements().size() + " device chrome element(s)");
        }

        // Step 2: normalize
        NormalizedNode normalized = normalizer.normalize(target, options.toFilterOptions(safeArea.getExcludeIds()));
        DetectionResult rawDetections = DetectionResult.builder()
                .variants(variants)
                .modalOverlay(modal)
                .safeArea(safeArea)
                .build();
        if (normalized == null) {
            log.warn("Node {} '{}' was filtered out entirely, emitting an empty container", target.getId(),
                    target.getName());
            diagnostics.getWarnings().add("No nodes left after filtering '" + target.getName() + "'");
            return placeholder(target, rawDetections, diagnostics);
        }

        // Step 3: layout
        LayoutNode layoutTree = layoutEngine.addLayoutInfo(normalized, ParentContext.ROOT);

        // Step 4: semantic classification
        IrNode ir = classifier.recognize(layoutTree);

        // Step 5: styles
        StylesBundle stylesBundle = styleExtractor.extractStyles(ir, layoutTree);

        // Step 6: IR detectors
        DetectionResult patterns = patternDetectors.detect(ir);
        DetectionResult detection = rawDetections.toBuilder()
                .lists(patterns.getLists())
                .components(patterns.getComponents())
                .build();

        log.info("Lowered '{}': {} styles, {} list(s), {} component candidate(s)", target.getName(),
                stylesBundle.getStyles().size(), detection.getLists().size(), detection.getComponents().size());
        return LoweringResult.builder()
                .id(target.getId())
                .name(target.getName())
                .root(ir)
                .stylesBundle(stylesBundle)
                .detection(detection)
                .diagnostics(diagnostics)
                .placeholder(false)
                .build();
    }

    private static LoweringResult placeholder(RawNode target, DetectionResult detection,
                                              PipelineDiagnostics diagnostics) {
        IrNode root = ContainerIr.builder()
                .id(target.getId())
                .name(target.getName())
                .boundingBox(BoundingBox.ZERO)
                .styleRef(StyleExtractor.EMPTY_STYLE_REF)
                .layout(LayoutMeta.emptyColumn())
                .build();
        return LoweringResult.builder()
                .id(target.getId())
                .name(target.getName())
                .root(root)
                .stylesBundle(StyleExtractor.emptyBundle())
                .detection(detection)
                .diagnostics(diagnostics)
                .placeholder(true)
                .build();
    }
}

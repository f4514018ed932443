package com.designtool.lowering.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.designtool.lowering.io.LoweringResultWriter;
import com.designtool.lowering.model.detection.ModalType;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.SemanticType;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.model.raw.RgbaColor;
import com.designtool.lowering.model.raw.SolidFill;
import com.designtool.lowering.styles.StyleExtractor;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the lowering pipeline.
 */
class LoweringPipelineTest {

    private final LoweringPipeline pipeline = new LoweringPipeline();

    @Test
    void testLowersScreenWithChrome() {
        LoweringResult result = pipeline.lower(screenWithChrome());

        assertThat(result.isPlaceholder()).isFalse();
        assertThat(result.getId()).isEqualTo("root");
        assertThat(collectIds(result.getRoot())).doesNotContain("sb", "clock", "hi", "pill");
        assertThat(result.getDetection().getSafeArea().getInsets().getTop()).isEqualTo(44);
        assertThat(result.getDiagnostics().getInfos()).anyMatch(info -> info.contains("device chrome"));
        assertThat(collectStyleRefs(result.getRoot()))
                .allSatisfy(ref -> assertThat(result.getStylesBundle().contains(ref)).isTrue());
    }

    @Test
    void testListsAndComponentsAreMergedIntoDetection() {
        RawNode root = frame("root", "Orders", box(0, 0, 375, 300),
                row("r1", "Order Row 1", 0),
                row("r2", "Order Row 2", 70),
                row("r3", "Order Row 3", 140));

        LoweringResult result = pipeline.lower(root);

        assertThat(result.getDetection().getLists()).isNotEmpty();
        assertThat(result.getDetection().getSafeArea().getElements()).isEmpty();
        assertThat(result.getDetection().getModalOverlay().isHasModalOverlay()).isFalse();
    }

    @Test
    void testModalContentReplacesScreen() {
        RawNode root = modalScreen();

        LoweringResult result = pipeline.lower(root);

        assertThat(result.getId()).isEqualTo("sheet");
        assertThat(result.getName()).isEqualTo("Payment");
        assertThat(result.getDetection().getModalOverlay().getModalType()).isEqualTo(ModalType.BOTTOM_SHEET);
        assertThat(result.getDetection().getModalOverlay().getBackgroundIds()).containsExactly("bg", "bg1");
        assertThat(collectIds(result.getRoot())).doesNotContain("bg", "bg1", "scrim");
        assertThat(result.getDiagnostics().getInfos()).anyMatch(info -> info.contains("Payment"));
    }

    @Test
    void testModalDetectionCanBeDisabled() {
        PipelineOptions options = PipelineOptions.builder().detectModalOverlay(false).build();

        LoweringResult result = pipeline.lower(modalScreen(), options);

        assertThat(result.getId()).isEqualTo("root");
        assertThat(result.getDetection().getModalOverlay().isHasModalOverlay()).isFalse();
    }

    @Test
    void testUnnamedStatusBarExcludedOnlyWhenDetectionEnabled() {
        PipelineOptions disabled = PipelineOptions.builder().detectSafeArea(false).build();

        LoweringResult detected = pipeline.lower(screenWithUnnamedStatusBar());
        LoweringResult kept = pipeline.lower(screenWithUnnamedStatusBar(), disabled);

        assertThat(collectIds(detected.getRoot())).doesNotContain("top", "clock");
        assertThat(kept.getDetection().getSafeArea().getElements()).isEmpty();
        assertThat(collectIds(kept.getRoot())).contains("top", "clock");
    }

    @Test
    void testFullyFilteredRootGivesPlaceholder() {
        PipelineOptions options = PipelineOptions.builder().excludeId("root").build();

        LoweringResult result = pipeline.lower(screenWithChrome(), options);

        assertThat(result.isPlaceholder()).isTrue();
        assertThat(result.getRoot()).isInstanceOf(ContainerIr.class);
        assertThat(result.getRoot().getId()).isEqualTo("root");
        assertThat(result.getRoot().getChildren()).isEmpty();
        assertThat(result.getRoot().getStyleRef()).isEqualTo(StyleExtractor.EMPTY_STYLE_REF);
        assertThat(result.getStylesBundle().contains(StyleExtractor.EMPTY_STYLE_REF)).isTrue();
        assertThat(result.getDiagnostics().hasWarnings()).isTrue();
    }

    @Test
    void testIgnorePatternDropsMatchingNodes() {
        PipelineOptions options = PipelineOptions.builder().ignorePattern("Promo*").build();
        RawNode root = frame("root", "Home", box(0, 0, 375, 400),
                frame("promo", "Promo Banner", box(0, 0, 375, 100), solid(BLUE),
                        text("p1", "Label", "Sale", box(16, 30, 100, 20))),
                text("t", "Title", "Welcome", box(16, 120, 200, 24)),
                text("s", "Subtitle", "Good morning", box(16, 160, 200, 20)));

        LoweringResult result = pipeline.lower(root, options);

        assertThat(collectIds(result.getRoot())).doesNotContain("promo", "p1").contains("t", "s");
    }

    @Test
    void testOutputIsDeterministic() throws Exception {
        LoweringResultWriter writer = new LoweringResultWriter();

        String first = writer.writeToString(new LoweringPipeline().lower(screenWithChrome()));
        String second = writer.writeToString(new LoweringPipeline().lower(screenWithChrome()));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testSemanticTypesOfScreen() {
        RawNode root = frame("root", "Login", box(0, 0, 375, 300),
                text("t", "Title", "Welcome back", box(16, 20, 300, 32)),
                frame("btn", "Sign In Button", box(16, 200, 343, 48), solid(BLUE),
                        text("bl", "Label", "Sign in", box(150, 214, 60, 20))));

        IrNode ir = pipeline.lower(root).getRoot();

        assertThat(ir.getChildren()).extracting(IrNode::getSemanticType)
                .containsExactly(SemanticType.TEXT, SemanticType.BUTTON);
    }

    private static RawNode screenWithChrome() {
        return frame("root", "Home", box(0, 0, 375, 812),
                frame("sb", "Status Bar", box(0, 0, 375, 44),
                        text("clock", "Time", "9:41", box(20, 12, 40, 20))),
                frame("content", "Content", box(0, 44, 375, 734),
                        text("t", "Title", "Hello", box(16, 60, 200, 24)),
                        text("s", "Subtitle", "Welcome back", box(16, 100, 200, 20))),
                frame("hi", "Home Indicator", box(0, 778, 375, 34),
                        rect("pill", "Pill", box(121, 799, 134, 5), solid(BLACK))));
    }

    private static RawNode screenWithUnnamedStatusBar() {
        return frame("root", "Home", box(0, 0, 375, 812),
                frame("top", "Frame 1", box(0, 0, 375, 44),
                        text("clock", "Label", "9:41", box(20, 12, 40, 20))),
                text("t", "Title", "Hello", box(16, 60, 200, 24)),
                text("s", "Subtitle", "Welcome back", box(16, 100, 200, 20)));
    }

    private static RawNode modalScreen() {
        NodeProperties scrim = NodeProperties.builder()
                .fill(SolidFill.of(new RgbaColor(0, 0, 0, 0.45)))
                .build();
        NodeProperties sheet = NodeProperties.builder()
                .fill(SolidFill.of(WHITE))
                .cornerRadius(new CornerRadius(16, 16, 0, 0))
                .build();
        return frame("root", "Checkout", box(0, 0, 375, 812),
                frame("bg", "Background", box(0, 0, 375, 812),
                        text("bg1", "Title", "Cart", box(16, 60, 100, 24))),
                frame("scrim", "Overlay", box(0, 0, 375, 812), scrim,
                        frame("sheet", "Payment", box(0, 412, 375, 400), sheet,
                                text("s1", "Heading", "Pay now", box(16, 430, 200, 24)),
                                text("s2", "Total", "$40.00", box(16, 470, 200, 24)))));
    }

    private static RawNode row(String id, String name, double y) {
        return frame(id, name, box(0, y, 375, 60),
                text(id + "a", "Title", "Order " + id, box(16, y + 8, 200, 20)),
                text(id + "b", "Status", "Shipped", box(16, y + 32, 200, 20)));
    }

    private static List<String> collectIds(IrNode node) {
        List<String> ids = new ArrayList<>();
        ids.add(node.getId());
        node.getChildren().forEach(child -> ids.addAll(collectIds(child)));
        return ids;
    }

    private static List<String> collectStyleRefs(IrNode node) {
        List<String> refs = new ArrayList<>();
        refs.add(node.getStyleRef());
        node.getChildren().forEach(child -> refs.addAll(collectStyleRefs(child)));
        return refs;
    }
}

package com.designtool.lowering.detection;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.designtool.lowering.model.detection.InteractionState;
import com.designtool.lowering.model.detection.StateStyle;
import com.designtool.lowering.model.detection.VariantDetection;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.model.raw.RgbaColor;
import com.designtool.lowering.model.raw.SolidFill;

import static com.designtool.lowering.support.NodeFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VariantStateDetector.
 */
class VariantStateDetectorTest {

    private static final RgbaColor DARK_BLUE = RgbaColor.opaque(0, 90, 200);

    private final VariantStateDetector detector = new VariantStateDetector();

    @Test
    void testButtonComponentSet() {
        RawNode set = node("set", "primary button", NodeType.COMPONENT_SET, box(0, 0, 400, 200), NodeProperties.EMPTY,
                variant("v1", "State=Pressed, Size=Large", solid(DARK_BLUE)),
                variant("v2", "State=Default, Size=Large", solid(BLUE)),
                variant("v3", "State=Disabled, Size=Small",
                        NodeProperties.builder().fill(SolidFill.of(BLUE)).opacity(0.4).build()),
                variant("v4", "State=Loading, Size=Large", solid(BLUE),
                        rect("spin", "Spinner", box(0, 0, 16, 16))));

        VariantDetection detection = detector.detectComponentSet(set).orElseThrow();

        assertThat(detection.getComponentSetId()).isEqualTo("set");
        assertThat(detection.getComponentName()).isEqualTo("PrimaryButton");
        assertThat(detection.getProperties()).hasSize(2);
        assertThat(detection.getProperties().get(0).getName()).isEqualTo("State");
        assertThat(detection.getProperties().get(0).getValues())
                .containsExactly("Default", "Disabled", "Loading", "Pressed");
        assertThat(detection.getProperties().get(0).getDefaultValue()).isEqualTo("Default");
        assertThat(detection.getProperties().get(1).getValues()).containsExactly("Large", "Small");

        List<StateStyle> states = detection.getStates();
        assertThat(states).extracting(StateStyle::getState).containsExactly(
                InteractionState.PRESSED, InteractionState.DEFAULT, InteractionState.DISABLED,
                InteractionState.LOADING);
        assertThat(states.get(0).getStyleOverrides()).isEqualTo(Map.of("backgroundColor", "#005AC8"));
        assertThat(states.get(1).getStyleOverrides()).isEmpty();
        assertThat(states.get(2).getStyleOverrides()).isEqualTo(Map.of("opacity", "0.4"));
        assertThat(states.get(3).isHasIndicator()).isTrue();
        assertThat(states.get(3).getStyleOverrides()).isEmpty();
    }

    @Test
    void testStateFromVisualsWhenNameHasNoKeyword() {
        RawNode set = node("set", "Field", NodeType.COMPONENT_SET, box(0, 0, 400, 200), NodeProperties.EMPTY,
                variant("v1", "Type=Plain", solid(WHITE)),
                variant("v2", "Type=Faded", NodeProperties.builder().fill(SolidFill.of(WHITE)).opacity(0.5).build()),
                variant("v3", "Type=Broken", solid(WHITE), rect("w", "Warning Icon", box(0, 0, 16, 16))));

        List<StateStyle> states = detector.detectComponentSet(set).orElseThrow().getStates();

        assertThat(states).extracting(StateStyle::getState).containsExactly(
                InteractionState.DEFAULT, InteractionState.DISABLED, InteractionState.ERROR);
        assertThat(states.get(2).isHasIndicator()).isTrue();
    }

    @Test
    void testDetectFindsNestedSetsInDocumentOrder() {
        RawNode root = frame("root", "Library", box(0, 0, 1000, 1000),
                node("s1", "Chip", NodeType.COMPONENT_SET, box(0, 0, 100, 100), NodeProperties.EMPTY,
                        variant("c1", "State=Default", solid(WHITE))),
                frame("page", "Page", box(0, 200, 1000, 800),
                        node("s2", "Toggle", NodeType.COMPONENT_SET, box(0, 200, 100, 100), NodeProperties.EMPTY,
                                variant("t1", "Status=On", solid(BLUE)))));

        List<VariantDetection> detections = detector.detect(root);

        assertThat(detections).extracting(VariantDetection::getComponentSetId).containsExactly("s1", "s2");
    }

    @Test
    void testSetWithoutParsableVariantsIsSkipped() {
        RawNode set = node("set", "Misc", NodeType.COMPONENT_SET, box(0, 0, 100, 100), NodeProperties.EMPTY,
                variant("v1", "Just a name", solid(WHITE)),
                rect("r", "State=Default", box(0, 0, 10, 10)));

        assertThat(detector.detectComponentSet(set)).isEmpty();
    }

    @Test
    void testParseVariantName() {
        assertThat(VariantStateDetector.parseVariantName("State=Pressed, Size = Large, junk, =x"))
                .containsExactly(entry("State", "Pressed"), entry("Size", "Large"));
        assertThat(VariantStateDetector.parseVariantName(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "Pressed, PRESSED",
            "Active, PRESSED",
            "Disabled, DISABLED",
            "Loading, LOADING",
            "Invalid, ERROR",
            "Hovered, HOVER",
            "Focus Visible, FOCUSED",
            "Idle, DEFAULT"
    })
    void testStateFromKeyword(String value, InteractionState expected) {
        assertThat(VariantStateDetector.stateFromKeyword(value)).contains(expected);
    }

    @Test
    void testKeywordsOnlyReadFromStateProperties() {
        assertThat(VariantStateDetector.keywordState(Map.of("Size", "Disabled"))).isEmpty();
        assertThat(VariantStateDetector.keywordState(Map.of("variant", "Error"))).contains(InteractionState.ERROR);
        assertThat(VariantStateDetector.stateFromKeyword("Large")).isEmpty();
    }

    private static RawNode variant(String id, String name, NodeProperties props, RawNode... children) {
        return node(id, name, NodeType.COMPONENT, box(0, 0, 120, 44), props, children);
    }
}

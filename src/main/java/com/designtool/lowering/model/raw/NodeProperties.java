package com.designtool.lowering.model.raw;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Visual, layout and component properties of a node. Every field is optional:
 * a missing value means the feature is absent. Shared unchanged by the raw,
 * normalized and layout trees.
 */
@Value
@Builder(toBuilder = true)
public class NodeProperties {
    public static final NodeProperties EMPTY = NodeProperties.builder().build();

    @Singular
    List<Fill> fills;
    @Singular
    List<Stroke> strokes;
    @Singular
    List<Effect> effects;
    CornerRadius cornerRadius;
    Double opacity;

    String text;
    Typography typography;

    AutoLayout autoLayout;
    AxisSizingMode primaryAxisSizingMode;
    AxisSizingMode counterAxisSizingMode;
    LayoutAlign layoutAlign;
    Double layoutGrow;
    LayoutPositioning layoutPositioning;
    Constraints constraints;
    OverflowDirection overflowDirection;

    String componentId;
    @Singular
    Map<String, String> variantProperties;

    public double opacityOrDefault() {
        return opacity != null ? opacity : 1.0;
    }

    public boolean hasAutoLayout() {
        return autoLayout != null && autoLayout.getMode() != null && autoLayout.getMode() != LayoutMode.NONE;
    }

    public Optional<SolidFill> firstSolidFill() {
        return fills.stream()
                .filter(SolidFill.class::isInstance)
                .map(SolidFill.class::cast)
                .findFirst();
    }

    public boolean hasImageFill() {
        return fills.stream().anyMatch(ImageFill.class::isInstance);
    }

    public Optional<ImageFill> firstImageFill() {
        return fills.stream()
                .filter(ImageFill.class::isInstance)
                .map(ImageFill.class::cast)
                .findFirst();
    }

    public boolean hasEffect(EffectType type) {
        return effects.stream().anyMatch(e -> e.getType() == type);
    }

    public boolean hasCornerRadius() {
        return cornerRadius != null && !cornerRadius.isZero();
    }

    /**
     * True when the node paints something of its own.
     */
    public boolean hasVisualProperties() {
        return !fills.isEmpty()
                || !strokes.isEmpty()
                || !effects.isEmpty()
                || hasCornerRadius()
                || (opacity != null && opacity != 1.0);
    }
}

package com.designtool.lowering.styles;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.ir.ButtonIr;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ComponentIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IconIr;
import com.designtool.lowering.model.ir.ImageIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.IrNodeVisitor;
import com.designtool.lowering.model.ir.RepeaterIr;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.model.layout.AbsolutePlacement;
import com.designtool.lowering.model.layout.CrossAlign;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.Length;
import com.designtool.lowering.model.layout.MainAlign;
import com.designtool.lowering.model.layout.Sizing;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.Effect;
import com.designtool.lowering.model.raw.EffectType;
import com.designtool.lowering.model.raw.Fill;
import com.designtool.lowering.model.raw.GradientFill;
import com.designtool.lowering.model.raw.GradientStop;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.SolidFill;
import com.designtool.lowering.model.raw.Stroke;
import com.designtool.lowering.model.raw.Typography;
import com.designtool.lowering.model.style.DesignTokens;
import com.designtool.lowering.model.style.ExtractedStyle;
import com.designtool.lowering.model.style.GradientStyle;
import com.designtool.lowering.model.style.ShadowStyle;
import com.designtool.lowering.model.style.StylesBundle;
import com.designtool.lowering.model.style.TypographyStyle;

/**
 * Fourth lowering pass. Builds a style for every IR node, registers it in a
 * deduplicating {@link StyleRegistry} and rewrites each node's style reference
 * to the registered name. Traversal is pre-order with children in their
 * original order, so the first occurrence of a style always owns its name.
 */
public class StyleExtractor {

    private static final Logger log = LoggerFactory.getLogger(StyleExtractor.class);

    public static final String EMPTY_STYLE_REF = "style_empty";

    private static final String DEFAULT_TEXT_COLOR = "#000000";

    private final TokenCollector tokenCollector;

    public StyleExtractor() {
        this(new TokenCollector());
    }

    public StyleExtractor(TokenCollector tokenCollector) {
        this.tokenCollector = tokenCollector;
    }

    public StylesBundle extractStyles(IrNode ir, LayoutNode layoutTree) {
        Map<String, LayoutNode> nodesById = new HashMap<>();
        Map<String, LayoutType> parentTypeById = new HashMap<>();
        index(layoutTree, null, nodesById, parentTypeById);

        StyleRegistry registry = new StyleRegistry();
        ir.accept(new StyleAssigner(registry, nodesById, parentTypeById));

        Map<String, ExtractedStyle> styles = new LinkedHashMap<>(registry.getStyles());
        log.debug("Registered {} styles ({} deduplicated)", styles.size(), registry.getDedupedCount());
        return new StylesBundle(styles, tokenCollector.collect(styles, layoutTree));
    }

    /**
     * Bundle for a screen whose root was filtered out.
     */
    public static StylesBundle emptyBundle() {
        Map<String, ExtractedStyle> styles = new LinkedHashMap<>();
        styles.put(EMPTY_STYLE_REF, ExtractedStyle.builder().build());
        return new StylesBundle(styles, DesignTokens.empty());
    }

    private static void index(LayoutNode node, LayoutType parentType, Map<String, LayoutNode> nodesById,
                              Map<String, LayoutType> parentTypeById) {
        nodesById.put(node.getId(), node);
        if (parentType != null) {
            parentTypeById.put(node.getId(), parentType);
        }
        for (LayoutNode child : node.getChildren()) {
            index(child, node.getLayout().getType(), nodesById, parentTypeById);
        }
    }

    /**
     * Builds the style of one layout node.
     */
    ExtractedStyle buildStyle(LayoutNode node, LayoutType parentType) {
        NodeProperties props = node.getProperties();
        boolean text = node.getType() == NodeType.TEXT;
        ExtractedStyle.ExtractedStyleBuilder style = ExtractedStyle.builder();

        if (!text) {
            applyBackground(style, props.getFills());
        }
        applyBorder(style, props.getStrokes());
        applyEffects(style, props.getEffects());
        applyCornerRadius(style, props.getCornerRadius());
        if (props.getOpacity() != null && props.getOpacity() != 1.0) {
            style.opacity(props.getOpacity());
        }
        if (text && props.getTypography() != null) {
            style.typography(toTypography(props.getTypography(), props.getFills()));
        }

        applySize(style, node, parentType);
        applyPlacement(style, node.getPlacement());
        applyFlex(style, node.getLayout());
        return style.build();
    }

    private static void applyBackground(ExtractedStyle.ExtractedStyleBuilder style, List<Fill> fills) {
        Optional<Fill> visible = fills.stream().filter(f -> f.getOpacity() > 0).findFirst();
        if (visible.isEmpty()) {
            return;
        }
        Fill fill = visible.get();
        if (fill instanceof SolidFill solid) {
            style.backgroundColor(ColorResolver.resolveEffectiveColor(solid.getColor(), solid.getOpacity()));
        } else if (fill instanceof GradientFill gradient) {
            style.backgroundGradient(toGradient(gradient));
        }
    }

    private static GradientStyle toGradient(GradientFill gradient) {
        return GradientStyle.builder()
                .type(gradient.getGradientType())
                .colors(gradient.getStops().stream()
                        .map(stop -> ColorResolver.resolveEffectiveColor(stop.getColor(), gradient.getOpacity()))
                        .toList())
                .positions(gradient.getStops().stream().map(GradientStop::getPosition).toList())
                .angle(gradient.getAngle())
                .build();
    }

    private static void applyBorder(ExtractedStyle.ExtractedStyleBuilder style, List<Stroke> strokes) {
        if (strokes.isEmpty()) {
            return;
        }
        Stroke stroke = strokes.get(0);
        style.borderColor(ColorResolver.resolveEffectiveColor(stroke.getColor(), stroke.getOpacity()));
        style.borderWidth(stroke.getWeight());
    }

    // Drop shadow wins over inner shadow; blur radius comes from either blur effect.
    private static void applyEffects(ExtractedStyle.ExtractedStyleBuilder style, List<Effect> effects) {
        Optional<Effect> shadow = effects.stream().filter(e -> e.getType() == EffectType.DROP_SHADOW).findFirst();
        if (shadow.isEmpty()) {
            shadow = effects.stream().filter(e -> e.getType() == EffectType.INNER_SHADOW).findFirst();
        }
        shadow.ifPresent(e -> style.shadow(toShadow(e)));

        effects.stream()
                .filter(e -> e.getType() == EffectType.LAYER_BLUR || e.getType() == EffectType.BACKGROUND_BLUR)
                .findFirst()
                .ifPresent(e -> style.blur(e.getRadius()));
    }

    static ShadowStyle toShadow(Effect effect) {
        return ShadowStyle.builder()
                .color(effect.getColor() != null
                        ? ColorResolver.resolveEffectiveColor(effect.getColor(), 1.0)
                        : DEFAULT_TEXT_COLOR)
                .offsetX(effect.getOffsetX())
                .offsetY(effect.getOffsetY())
                .blur(effect.getRadius())
                .spread(effect.getSpread())
                .inset(effect.getType() == EffectType.INNER_SHADOW)
                .build();
    }

    private static void applyCornerRadius(ExtractedStyle.ExtractedStyleBuilder style, CornerRadius radius) {
        if (radius == null || radius.isZero()) {
            return;
        }
        if (radius.isUniform()) {
            style.borderRadius(radius.getTopLeft());
        } else {
            style.borderRadii(radius);
        }
    }

    private static TypographyStyle toTypography(Typography typography, List<Fill> fills) {
        return TypographyStyle.builder()
                .fontFamily(typography.getFontFamily())
                .fontSize(typography.getFontSize())
                .fontWeight(typography.getFontWeight())
                .lineHeight(typography.getLineHeight())
                .letterSpacing(typography.getLetterSpacing())
                .textAlign(typography.getTextAlign())
                .textDecoration(typography.getTextDecoration())
                .textCase(typography.getTextCase())
                .color(textColor(fills))
                .build();
    }

    // Solid fill first, else the first gradient stop.
    private static String textColor(List<Fill> fills) {
        for (Fill fill : fills) {
            if (fill instanceof SolidFill solid) {
                return ColorResolver.resolveEffectiveColor(solid.getColor(), solid.getOpacity());
            }
        }
        for (Fill fill : fills) {
            if (fill instanceof GradientFill gradient && !gradient.getStops().isEmpty()) {
                return ColorResolver.resolveEffectiveColor(gradient.getStops().get(0).getColor(), gradient.getOpacity());
            }
        }
        return DEFAULT_TEXT_COLOR;
    }

    private static void applySize(ExtractedStyle.ExtractedStyleBuilder style, LayoutNode node, LayoutType parentType) {
        LayoutMeta layout = node.getLayout();
        Sizing horizontal = layout.getSizing().getHorizontal();
        Sizing vertical = layout.getSizing().getVertical();

        if (horizontal == Sizing.FIXED) {
            style.width(Length.px(Math.round(node.getBoundingBox().getWidth())));
        }
        if (vertical == Sizing.FIXED) {
            style.height(Length.px(Math.round(node.getBoundingBox().getHeight())));
        }

        // Filling the parent's main axis grows the node; the cross axis stretches it.
        boolean fillsMainAxis = (parentType == LayoutType.ROW && horizontal == Sizing.FILL)
                || (parentType == LayoutType.COLUMN && vertical == Sizing.FILL);
        if (fillsMainAxis) {
            style.flex(1);
        }
        if (parentType == LayoutType.ROW && vertical == Sizing.FILL) {
            style.height(Length.percent(100));
        }
        if (parentType == LayoutType.COLUMN && horizontal == Sizing.FILL) {
            style.width(Length.percent(100));
        }
    }

    private static void applyPlacement(ExtractedStyle.ExtractedStyleBuilder style, AbsolutePlacement placement) {
        if (placement == null) {
            return;
        }
        style.position("absolute")
                .left(placement.getLeft())
                .right(placement.getRight())
                .top(placement.getTop())
                .bottom(placement.getBottom());
        if (placement.getWidth() != null) {
            style.width(placement.getWidth());
        }
        if (placement.getHeight() != null) {
            style.height(placement.getHeight());
        }
    }

    static void applyFlex(ExtractedStyle.ExtractedStyleBuilder style, LayoutMeta layout) {
        if (layout == null) {
            return;
        }
        if (layout.getType().isFlow()) {
            style.flexDirection(layout.getType() == LayoutType.ROW ? "row" : "column");
            if (layout.getGap() > 0) {
                style.gap(layout.getGap());
            }
            style.justifyContent(justifyContent(layout.getMainAlign()));
            style.alignItems(alignItems(layout.getCrossAlign()));
        } else if (layout.getType() == LayoutType.STACK) {
            style.position("relative");
        }
        if (layout.getPadding() != null && !layout.getPadding().isZero()) {
            style.padding(layout.getPadding());
        }
        if (layout.getOverflow() != null) {
            style.overflow(layout.getOverflow().getValue());
        }
    }

    private static String justifyContent(MainAlign align) {
        return switch (align) {
            case START -> null;
            case CENTER -> "center";
            case END -> "flex-end";
            case SPACE_BETWEEN -> "space-between";
            case SPACE_AROUND -> "space-around";
        };
    }

    private static String alignItems(CrossAlign align) {
        return switch (align) {
            case START -> null;
            case CENTER -> "center";
            case END -> "flex-end";
            case STRETCH -> "stretch";
            case BASELINE -> "baseline";
        };
    }

    /**
     * Registers styles in pre-order and writes the final names back into the IR.
     */
    private final class StyleAssigner implements IrNodeVisitor<Void> {

        private final StyleRegistry registry;
        private final Map<String, LayoutNode> nodesById;
        private final Map<String, LayoutType> parentTypeById;

        private StyleAssigner(StyleRegistry registry, Map<String, LayoutNode> nodesById,
                              Map<String, LayoutType> parentTypeById) {
            this.registry = registry;
            this.nodesById = nodesById;
            this.parentTypeById = parentTypeById;
        }

        @Override
        public Void visit(ContainerIr container) {
            assign(container);
            return visitChildren(container);
        }

        @Override
        public Void visit(TextIr text) {
            assign(text);
            return null;
        }

        @Override
        public Void visit(ImageIr image) {
            assign(image);
            return null;
        }

        @Override
        public Void visit(IconIr icon) {
            assign(icon);
            return null;
        }

        @Override
        public Void visit(ButtonIr button) {
            String buttonRef = assign(button);
            if (button.getTextId() != null) {
                button.assignTextStyleRef(registerFor(button.getTextId(), buttonRef + "Text"));
            }
            if (button.getIconId() != null) {
                button.assignIconStyleRef(registerFor(button.getIconId(), buttonRef + "Icon"));
            }
            return null;
        }

        @Override
        public Void visit(CardIr card) {
            assign(card);
            return visitChildren(card);
        }

        @Override
        public Void visit(RepeaterIr repeater) {
            ExtractedStyle.ExtractedStyleBuilder style = ExtractedStyle.builder();
            applyFlex(style, repeater.getLayout());
            repeater.assignStyleRef(registry.register(repeater.getStyleRef(), style.build()));
            return visitChildren(repeater);
        }

        @Override
        public Void visit(ComponentIr component) {
            assign(component);
            return visitChildren(component);
        }

        private String assign(IrNode node) {
            String name = registerFor(node.getId(), node.getStyleRef());
            node.assignStyleRef(name);
            return name;
        }

        private String registerFor(String layoutId, String preferredName) {
            LayoutNode layoutNode = nodesById.get(layoutId);
            ExtractedStyle style = layoutNode != null
                    ? buildStyle(layoutNode, parentTypeById.get(layoutId))
                    : ExtractedStyle.builder().build();
            return registry.register(preferredName, style);
        }

        private Void visitChildren(IrNode node) {
            for (IrNode child : node.getChildren()) {
                child.accept(this);
            }
            return null;
        }
    }
}

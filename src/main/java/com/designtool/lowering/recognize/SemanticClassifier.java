package com.designtool.lowering.recognize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.ir.ButtonIr;
import com.designtool.lowering.model.ir.ButtonVariant;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ComponentIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IconIr;
import com.designtool.lowering.model.ir.ImageIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.RepeaterIr;
import com.designtool.lowering.model.ir.SemanticType;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.layout.LayoutSizing;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.EffectType;
import com.designtool.lowering.model.raw.ImageFill;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.Padding;
import com.designtool.lowering.model.raw.SolidFill;
import com.designtool.lowering.util.NamingUtil;

/**
 * Third lowering pass: maps layout nodes to semantic IR variants through an
 * ordered rule list (first match wins) and folds repeated siblings into
 * repeaters.
 */
public class SemanticClassifier {

    private static final Logger log = LoggerFactory.getLogger(SemanticClassifier.class);

    static final double ICON_MIN_SIZE = 8;
    static final double ICON_MAX_SIZE = 64;
    static final double BUTTON_MAX_HEIGHT = 80;
    static final double BUTTON_MIN_WIDTH = 40;
    static final double CARD_MIN_SIZE = 60;

    private static final Pattern BUTTON_NAME = Pattern.compile("(?i).*\\b(button|btn|cta)\\b.*");

    private static final List<ClassificationRule> RULES = List.of(
            new ClassificationRule("component", SemanticClassifier::isComponent, SemanticType.COMPONENT),
            new ClassificationRule("text", SemanticClassifier::isText, SemanticType.TEXT),
            new ClassificationRule("icon", SemanticClassifier::isIcon, SemanticType.ICON),
            new ClassificationRule("image", SemanticClassifier::isImage, SemanticType.IMAGE),
            new ClassificationRule("button", SemanticClassifier::isButton, SemanticType.BUTTON),
            new ClassificationRule("card", SemanticClassifier::isCard, SemanticType.CARD));

    private final StyleRefNamer styleRefNamer;
    private final ContentPatternDetector contentPatternDetector;
    private final RepeaterGrouper repeaterGrouper;
    private final PropExtractor propExtractor;

    public SemanticClassifier() {
        this(new StyleRefNamer(), new ContentPatternDetector(), new RepeaterGrouper(), new PropExtractor());
    }

    public SemanticClassifier(StyleRefNamer styleRefNamer, ContentPatternDetector contentPatternDetector,
                              RepeaterGrouper repeaterGrouper, PropExtractor propExtractor) {
        this.styleRefNamer = styleRefNamer;
        this.contentPatternDetector = contentPatternDetector;
        this.repeaterGrouper = repeaterGrouper;
        this.propExtractor = propExtractor;
    }

    public IrNode recognize(LayoutNode root) {
        return toIrNode(root);
    }

    /**
     * First matching rule, {@link SemanticType#CONTAINER} when none applies.
     */
    public SemanticType classify(LayoutNode node) {
        for (ClassificationRule rule : RULES) {
            if (rule.matches(node)) {
                return rule.getResult();
            }
        }
        return SemanticType.CONTAINER;
    }

    private IrNode toIrNode(LayoutNode node) {
        SemanticType semanticType = classify(node);
        String styleRef = styleRefNamer.styleRefFor(node);
        log.debug("CLASSIFIED {} '{}' as {}", node.getId(), node.getName(), semanticType.getLabel());

        return switch (semanticType) {
            case COMPONENT -> toComponent(node, styleRef);
            case TEXT -> toText(node, styleRef);
            case ICON -> IconIr.builder()
                    .id(node.getId())
                    .name(node.getName())
                    .boundingBox(node.getBoundingBox())
                    .styleRef(styleRef)
                    .iconRef(styleRef)
                    .size(Math.max(node.getBoundingBox().getWidth(), node.getBoundingBox().getHeight()))
                    .build();
            case IMAGE -> {
                Optional<ImageFill> fill = node.getProperties().firstImageFill();
                yield ImageIr.builder()
                        .id(node.getId())
                        .name(node.getName())
                        .boundingBox(node.getBoundingBox())
                        .styleRef(styleRef)
                        .imageRef(fill.map(ImageFill::getImageRef).orElse(null))
                        .scaleMode(fill.map(ImageFill::getScaleMode).orElse(null))
                        .build();
            }
            case BUTTON -> toButton(node, styleRef);
            case CARD -> CardIr.builder()
                    .id(node.getId())
                    .name(node.getName())
                    .boundingBox(node.getBoundingBox())
                    .styleRef(styleRef)
                    .layout(node.getLayout())
                    .children(recognizeChildren(node))
                    .build();
            case CONTAINER, REPEATER -> ContainerIr.builder()
                    .id(node.getId())
                    .name(node.getName())
                    .boundingBox(node.getBoundingBox())
                    .styleRef(styleRef)
                    .layout(node.getLayout())
                    .children(recognizeChildren(node))
                    .build();
        };
    }

    private ComponentIr toComponent(LayoutNode node, String styleRef) {
        List<IrNode> children = node.getChildren().stream().map(this::toIrNode).toList();
        String componentId = node.getProperties().getComponentId();
        return ComponentIr.builder()
                .id(node.getId())
                .name(node.getName())
                .boundingBox(node.getBoundingBox())
                .styleRef(styleRef)
                .componentId(componentId != null ? componentId : "unknown")
                .componentName(NamingUtil.toPascalCase(node.getName()))
                .props(propExtractor.extract(children))
                .layout(node.getLayout())
                .children(children)
                .build();
    }

    private TextIr toText(LayoutNode node, String styleRef) {
        String text = node.getProperties().getText();
        String contentPattern = contentPatternDetector.detect(text);
        String propName = StyleRefNamer.isGenericName(node.getName()) && contentPattern != null
                ? contentPattern
                : NamingUtil.toValidIdentifier(node.getName());
        return TextIr.builder()
                .id(node.getId())
                .name(node.getName())
                .boundingBox(node.getBoundingBox())
                .styleRef(styleRef)
                .propName(propName)
                .text(text)
                .contentPattern(contentPattern)
                .build();
    }

    private ButtonIr toButton(LayoutNode node, String styleRef) {
        Optional<LayoutNode> label = findDescendant(node, SemanticClassifier::isText);
        Optional<LayoutNode> icon = findDescendant(node, SemanticClassifier::isIcon);
        return ButtonIr.builder()
                .id(node.getId())
                .name(node.getName())
                .boundingBox(node.getBoundingBox())
                .styleRef(styleRef)
                .label(label.map(l -> l.getProperties().getText()).orElse("Button"))
                .textId(label.map(LayoutNode::getId).orElse(null))
                .iconRef(icon.map(styleRefNamer::styleRefFor).orElse(null))
                .iconId(icon.map(LayoutNode::getId).orElse(null))
                .variant(inferButtonVariant(node.getProperties()))
                .layout(node.getLayout())
                .build();
    }

    private List<IrNode> recognizeChildren(LayoutNode parent) {
        List<IrNode> result = new ArrayList<>();
        for (List<LayoutNode> run : repeaterGrouper.group(parent.getChildren())) {
            if (run.size() >= RepeaterGrouper.MIN_REPEAT_COUNT) {
                result.add(toRepeater(parent, run));
            } else {
                result.add(toIrNode(run.get(0)));
            }
        }
        return result;
    }

    private RepeaterIr toRepeater(LayoutNode parent, List<LayoutNode> items) {
        LayoutNode first = items.get(0);
        String baseName = RepeaterGrouper.baseName(first);
        String identifier = NamingUtil.toValidIdentifier(baseName);
        log.debug("REPEATER {} items of '{}' under {}", items.size(), baseName, parent.getId());

        return RepeaterIr.builder()
                .id("repeater_" + first.getId())
                .name(baseName + " (Repeater)")
                .boundingBox(union(items))
                .styleRef("style_" + identifier + "_repeater")
                .itemComponentName(NamingUtil.toPascalCase(baseName))
                .dataPropName(NamingUtil.toScreamingSnakeCase(baseName) + "_DATA")
                .layout(repeaterLayout(parent.getLayout()))
                .children(items.stream().map(this::toIrNode).toList())
                .build();
    }

    // Items keep flowing in the parent's direction.
    private static LayoutMeta repeaterLayout(LayoutMeta parentLayout) {
        if (parentLayout == null || !parentLayout.getType().isFlow()) {
            return LayoutMeta.emptyColumn();
        }
        return parentLayout.toBuilder()
                .padding(Padding.ZERO)
                .sizing(LayoutSizing.FIXED)
                .overflow(null)
                .build();
    }

    private static BoundingBox union(List<LayoutNode> items) {
        double minX = items.stream().mapToDouble(n -> n.getBoundingBox().getX()).min().orElse(0);
        double minY = items.stream().mapToDouble(n -> n.getBoundingBox().getY()).min().orElse(0);
        double maxX = items.stream().mapToDouble(n -> n.getBoundingBox().right()).max().orElse(0);
        double maxY = items.stream().mapToDouble(n -> n.getBoundingBox().bottom()).max().orElse(0);
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    static ButtonVariant inferButtonVariant(NodeProperties props) {
        boolean hasStroke = !props.getStrokes().isEmpty();
        boolean hasSolidFill = props.getFills().stream()
                .anyMatch(f -> f instanceof SolidFill && f.getOpacity() > 0.1);
        if (hasStroke && !hasSolidFill) {
            return ButtonVariant.OUTLINE;
        }
        boolean lowOpacityFill = props.getFills().stream()
                .anyMatch(f -> f instanceof SolidFill && f.getOpacity() < 0.2);
        if (lowOpacityFill) {
            return ButtonVariant.GHOST;
        }
        return ButtonVariant.PRIMARY;
    }

    // Children and grandchildren, breadth first.
    private static Optional<LayoutNode> findDescendant(LayoutNode node, Predicate<LayoutNode> predicate) {
        for (LayoutNode child : node.getChildren()) {
            if (predicate.test(child)) {
                return Optional.of(child);
            }
        }
        for (LayoutNode child : node.getChildren()) {
            for (LayoutNode grandChild : child.getChildren()) {
                if (predicate.test(grandChild)) {
                    return Optional.of(grandChild);
                }
            }
        }
        return Optional.empty();
    }

    static boolean isComponent(LayoutNode node) {
        return node.getType() == NodeType.INSTANCE || node.getType() == NodeType.COMPONENT;
    }

    static boolean isText(LayoutNode node) {
        String text = node.getProperties().getText();
        return node.getType() == NodeType.TEXT && text != null && !text.isEmpty();
    }

    static boolean isIcon(LayoutNode node) {
        NodeType type = node.getType();
        boolean imageFill = node.getProperties().hasImageFill() && !node.hasChildren();
        if (!type.isVector() && !type.isFrameLike() && !imageFill) {
            return false;
        }

        double width = node.getBoundingBox().getWidth();
        double height = node.getBoundingBox().getHeight();
        if (width > ICON_MAX_SIZE || height > ICON_MAX_SIZE || width < ICON_MIN_SIZE || height < ICON_MIN_SIZE) {
            return false;
        }
        double aspect = width / height;
        if (aspect < 0.5 || aspect > 2) {
            return false;
        }

        if (type.isVector() || imageFill) {
            return true;
        }
        return node.hasChildren() && node.getChildren().stream().allMatch(c -> c.getType().isVector());
    }

    static boolean isImage(LayoutNode node) {
        return (node.getProperties().hasImageFill() && !node.hasChildren()) || node.getType().isVector();
    }

    static boolean isButton(LayoutNode node) {
        if (!node.hasChildren()) {
            return false;
        }
        NodeProperties props = node.getProperties();
        boolean hasBackground = props.firstSolidFill().isPresent();
        boolean hasOutline = !props.getStrokes().isEmpty();
        boolean buttonName = node.getName() != null && BUTTON_NAME.matcher(node.getName()).matches();
        if (!hasBackground && !hasOutline && !buttonName) {
            return false;
        }
        if (findDescendant(node, SemanticClassifier::isText).isEmpty()) {
            return false;
        }

        double width = node.getBoundingBox().getWidth();
        double height = node.getBoundingBox().getHeight();
        if (height > BUTTON_MAX_HEIGHT || width < BUTTON_MIN_WIDTH || height <= 0) {
            return false;
        }
        double aspect = width / height;
        // narrow buttons must be roughly square icon buttons
        return !(aspect < 1.5 && width < 60 && (aspect < 0.8 || aspect > 1.2));
    }

    static boolean isCard(LayoutNode node) {
        if (!node.hasChildren()) {
            return false;
        }
        NodeProperties props = node.getProperties();
        boolean radius = props.hasCornerRadius();
        boolean shadow = props.hasEffect(EffectType.DROP_SHADOW);
        boolean background = !props.getFills().isEmpty();
        boolean border = !props.getStrokes().isEmpty();

        int treatments = (radius ? 1 : 0) + (shadow ? 1 : 0) + (background ? 1 : 0) + (border ? 1 : 0);
        if (treatments < 2 || !(radius || shadow)) {
            return false;
        }
        double width = node.getBoundingBox().getWidth();
        double height = node.getBoundingBox().getHeight();
        return width >= CARD_MIN_SIZE && height >= CARD_MIN_SIZE;
    }
}

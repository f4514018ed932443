package com.designtool.lowering.layout;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.layout.AbsolutePlacement;
import com.designtool.lowering.model.layout.CrossAlign;
import com.designtool.lowering.model.layout.LayoutMeta;
import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.layout.LayoutType;
import com.designtool.lowering.model.layout.MainAlign;
import com.designtool.lowering.model.layout.Overflow;
import com.designtool.lowering.model.layout.ParentContext;
import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.LayoutPositioning;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.OverflowDirection;

/**
 * Second lowering pass. Walks the normalized tree top-down and attaches a
 * {@link LayoutMeta} to every node; children see their parent's resolved
 * layout type through {@link ParentContext}.
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutDetector detector;
    private final LayoutExtractor extractor;
    private final SizingResolver sizingResolver;
    private final ConstraintMapper constraintMapper;

    public LayoutEngine() {
        this(new LayoutDetector(), new LayoutExtractor(), new SizingResolver(), new ConstraintMapper());
    }

    public LayoutEngine(LayoutDetector detector, LayoutExtractor extractor, SizingResolver sizingResolver,
                        ConstraintMapper constraintMapper) {
        this.detector = detector;
        this.extractor = extractor;
        this.sizingResolver = sizingResolver;
        this.constraintMapper = constraintMapper;
    }

    public LayoutNode addLayoutInfo(NormalizedNode node, ParentContext parent) {
        LayoutMeta layout = computeLayout(node, parent);
        AbsolutePlacement placement = isConstraintPositioned(node, parent)
                ? constraintMapper.map(node, parent.getBounds())
                : null;

        ParentContext own = new ParentContext(layout.getType(), node.getBoundingBox());
        List<LayoutNode> children = node.getChildren().stream()
                .map(child -> addLayoutInfo(child, own))
                .toList();

        log.debug("LAYOUT {} '{}' -> {} gap={} main={} cross={}", node.getId(), node.getName(),
                layout.getType().getValue(), layout.getGap(), layout.getMainAlign().getValue(),
                layout.getCrossAlign().getValue());

        return LayoutNode.builder()
                .id(node.getId())
                .name(node.getName())
                .type(node.getType())
                .boundingBox(node.getBoundingBox())
                .properties(node.getProperties())
                .layout(layout)
                .placement(placement)
                .children(children)
                .build();
    }

    LayoutMeta computeLayout(NormalizedNode node, ParentContext parent) {
        LayoutType type = detector.detect(node);
        MainAlign mainAlign = extractor.resolveMainAlign(node, type);
        CrossAlign crossAlign = extractor.resolveCrossAlign(node, type);

        return LayoutMeta.builder()
                .type(type)
                .gap(detector.calculateGap(node, type))
                .padding(extractor.resolvePadding(node))
                .mainAlign(mainAlign)
                .crossAlign(crossAlign)
                .sizing(sizingResolver.resolve(node, type, parent))
                .overflow(resolveOverflow(node.getProperties()))
                .build();
    }

    private static Overflow resolveOverflow(NodeProperties props) {
        OverflowDirection direction = props.getOverflowDirection();
        return direction != null && direction != OverflowDirection.NONE ? Overflow.SCROLL : null;
    }

    private static boolean isConstraintPositioned(NormalizedNode node, ParentContext parent) {
        if (parent.isRoot() || node.getProperties().getConstraints() == null) {
            return false;
        }
        return !parent.getType().isFlow()
                || node.getProperties().getLayoutPositioning() == LayoutPositioning.ABSOLUTE;
    }
}

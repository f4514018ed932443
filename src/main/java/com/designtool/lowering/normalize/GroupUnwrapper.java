package com.designtool.lowering.normalize;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.NodeType;

/**
 * Collapses GROUP nodes that only wrap a single child and paint nothing
 * themselves. Runs bottom-up so nested wrappers collapse in one pass. The
 * root is never replaced.
 */
public class GroupUnwrapper {

    private static final Logger log = LoggerFactory.getLogger(GroupUnwrapper.class);

    public NormalizedNode unwrap(NormalizedNode root) {
        return rebuildChildren(root);
    }

    private NormalizedNode unwrapNode(NormalizedNode node) {
        NormalizedNode rebuilt = rebuildChildren(node);

        if (isUselessGroup(rebuilt)) {
            NormalizedNode onlyChild = rebuilt.getChildren().get(0);
            log.debug("UNWRAPPED group {} '{}' -> {}", rebuilt.getId(), rebuilt.getName(), onlyChild.getId());
            return onlyChild;
        }
        return rebuilt;
    }

    private NormalizedNode rebuildChildren(NormalizedNode node) {
        List<NormalizedNode> children = node.getChildren().stream()
                .map(this::unwrapNode)
                .toList();
        return node.toBuilder().clearChildren().children(children).build();
    }

    static boolean isUselessGroup(NormalizedNode node) {
        return node.getType() == NodeType.GROUP
                && node.getChildren().size() == 1
                && !node.getProperties().hasVisualProperties();
    }
}

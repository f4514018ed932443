package com.designtool.lowering.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.detection.ModalOverlayResult;
import com.designtool.lowering.model.detection.ModalType;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.model.raw.SolidFill;

/**
 * Detects screens that demonstrate a modal: a dimmed full-screen scrim with a
 * sheet or dialog on top. When found, only the modal content needs code.
 */
public class ModalOverlayDetector {

    private static final Logger log = LoggerFactory.getLogger(ModalOverlayDetector.class);

    static final double COVER_TOLERANCE = 2;
    static final double EDGE_TOLERANCE = 5;
    static final double MIN_CONTENT_HEIGHT = 50;
    static final double MIN_SCRIM_ALPHA = 0.1;
    static final double MAX_SCRIM_ALPHA = 0.8;

    private static final Pattern SHEET_NAME = Pattern.compile(".*(sheet|modal|bottom|drawer|overlay|dialog|popup).*");
    private static final Pattern DIALOG_NAME = Pattern.compile(".*(modal|dialog|popup|alert).*");

    public ModalOverlayResult detect(RawNode root) {
        if (root.getBoundingBox() == null) {
            return ModalOverlayResult.none();
        }
        for (RawNode child : root.getChildren()) {
            if (!child.getType().isFrameLike() || child.getBoundingBox() == null) {
                continue;
            }
            if (!coversParent(child.getBoundingBox(), root.getBoundingBox()) || !hasScrimFill(child)) {
                continue;
            }
            Optional<ModalContent> content = findModalContent(child);
            if (content.isPresent()) {
                RawNode node = content.get().node;
                log.info("Modal overlay {} detected: {} '{}'", child.getId(), content.get().type.getValue(),
                        node.getName());
                return ModalOverlayResult.builder()
                        .hasModalOverlay(true)
                        .modalType(content.get().type)
                        .overlayId(child.getId())
                        .contentId(node.getId())
                        .contentName(node.getName())
                        .backgroundIds(collectBackgroundIds(root, child.getId()))
                        .build();
            }
        }
        return ModalOverlayResult.none();
    }

    /**
     * Finds the node with the given id anywhere below {@code root}.
     */
    public static Optional<RawNode> findById(RawNode root, String id) {
        if (root.getId().equals(id)) {
            return Optional.of(root);
        }
        for (RawNode child : root.getChildren()) {
            Optional<RawNode> found = findById(child, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    static boolean coversParent(BoundingBox node, BoundingBox parent) {
        return Math.abs(node.getWidth() - parent.getWidth()) <= COVER_TOLERANCE
                && Math.abs(node.getHeight() - parent.getHeight()) <= COVER_TOLERANCE;
    }

    static boolean hasScrimFill(RawNode node) {
        return node.getProperties().getFills().stream()
                .filter(SolidFill.class::isInstance)
                .map(SolidFill.class::cast)
                .anyMatch(fill -> fill.effectiveAlpha() > MIN_SCRIM_ALPHA && fill.effectiveAlpha() < MAX_SCRIM_ALPHA);
    }

    private Optional<ModalContent> findModalContent(RawNode overlay) {
        BoundingBox overlayBox = overlay.getBoundingBox();
        for (RawNode child : overlay.getChildren()) {
            BoundingBox box = child.getBoundingBox();
            if (box == null || box.getHeight() < MIN_CONTENT_HEIGHT) {
                continue;
            }
            boolean bottomAligned = Math.abs(box.bottom() - overlayBox.bottom()) <= EDGE_TOLERANCE;
            boolean topAligned = Math.abs(box.getY() - overlayBox.getY()) <= EDGE_TOLERANCE;
            CornerRadius radius = child.getProperties().getCornerRadius();

            if (radius != null && radius.isTopRoundedOnly() && bottomAligned) {
                return Optional.of(new ModalContent(child, ModalType.BOTTOM_SHEET));
            }
            if (radius != null && radius.isBottomRoundedOnly() && topAligned) {
                return Optional.of(new ModalContent(child, ModalType.TOP_SHEET));
            }
            String name = child.getName() == null ? "" : child.getName().toLowerCase(Locale.ROOT);
            if (SHEET_NAME.matcher(name).matches()) {
                if (bottomAligned) {
                    return Optional.of(new ModalContent(child, ModalType.BOTTOM_SHEET));
                }
                if (topAligned) {
                    return Optional.of(new ModalContent(child, ModalType.TOP_SHEET));
                }
                if (DIALOG_NAME.matcher(name).matches()) {
                    return Optional.of(new ModalContent(child, ModalType.DIALOG));
                }
            }

            Optional<ModalContent> nested = findModalContent(child);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    private static List<String> collectBackgroundIds(RawNode root, String overlayId) {
        List<String> ids = new ArrayList<>();
        for (RawNode child : root.getChildren()) {
            if (!child.getId().equals(overlayId)) {
                collectIds(child, ids);
            }
        }
        return ids;
    }

    private static void collectIds(RawNode node, List<String> ids) {
        ids.add(node.getId());
        for (RawNode child : node.getChildren()) {
            collectIds(child, ids);
        }
    }

    private static final class ModalContent {
        private final RawNode node;
        private final ModalType type;

        private ModalContent(RawNode node, ModalType type) {
            this.node = node;
            this.type = type;
        }
    }
}

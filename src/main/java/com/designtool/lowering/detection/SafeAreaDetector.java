package com.designtool.lowering.detection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.detection.ChromeElement;
import com.designtool.lowering.model.detection.SafeAreaInsets;
import com.designtool.lowering.model.detection.SafeAreaResult;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.RawNode;

/**
 * Finds device chrome drawn into a mockup (status bar, home indicator,
 * system navigation bar) and explicit safe-area frames. The chrome ids feed
 * the normalizer's exclude set and the insets describe what the screen must
 * keep clear.
 */
public class SafeAreaDetector {

    private static final Logger log = LoggerFactory.getLogger(SafeAreaDetector.class);

    /** Screen used when the root carries no bounds. */
    static final BoundingBox DEFAULT_SCREEN = new BoundingBox(0, 0, 375, 812);

    static final double EDGE_TOLERANCE = 2;
    static final double FULL_WIDTH_RATIO = 0.9;
    static final double STATUS_BAR_MIN_HEIGHT = 18;
    static final double STATUS_BAR_MAX_HEIGHT = 54;
    static final double HOME_INDICATOR_MIN_HEIGHT = 30;
    static final double HOME_INDICATOR_MAX_HEIGHT = 40;

    public SafeAreaResult detect(RawNode root) {
        BoundingBox screen = root.getBoundingBox() != null ? root.getBoundingBox() : DEFAULT_SCREEN;
        Accumulator acc = new Accumulator(screen);
        for (RawNode child : root.getChildren()) {
            scan(child, acc);
        }
        if (acc.elements.isEmpty()) {
            return SafeAreaResult.none();
        }
        SafeAreaInsets insets = new SafeAreaInsets(acc.top, acc.bottom, acc.left, acc.right);
        log.info("Safe area: {} chrome element(s), insets top={} bottom={}", acc.elements.size(),
                insets.getTop(), insets.getBottom());
        return SafeAreaResult.builder()
                .insets(insets)
                .hasSafeAreaLayout(acc.hasSafeAreaFrame)
                .elements(acc.elements)
                .excludeIds(acc.excludeIds)
                .build();
    }

    private void scan(RawNode node, Accumulator acc) {
        Optional<ChromeElement> kind = classify(node, acc.screen);
        if (kind.isEmpty()) {
            for (RawNode child : node.getChildren()) {
                scan(child, acc);
            }
            return;
        }
        acc.elements.put(node.getId(), kind.get());
        BoundingBox box = node.getBoundingBox();
        switch (kind.get()) {
            case SAFE_AREA:
                acc.hasSafeAreaFrame = true;
                if (box != null) {
                    acc.top = Math.max(acc.top, box.getY() - acc.screen.getY());
                    acc.bottom = Math.max(acc.bottom, acc.screen.bottom() - box.bottom());
                    acc.left = Math.max(acc.left, box.getX() - acc.screen.getX());
                    acc.right = Math.max(acc.right, acc.screen.right() - box.right());
                }
                // content lives inside the safe-area frame
                for (RawNode child : node.getChildren()) {
                    scan(child, acc);
                }
                break;
            case STATUS_BAR:
                if (box != null) {
                    acc.top = Math.max(acc.top, box.bottom() - acc.screen.getY());
                }
                collectIds(node, acc.excludeIds);
                break;
            case HOME_INDICATOR:
            case NAVIGATION_BAR:
                if (box != null) {
                    if (isInUpperHalf(box, acc.screen)) {
                        acc.top = Math.max(acc.top, box.bottom() - acc.screen.getY());
                    } else {
                        acc.bottom = Math.max(acc.bottom, acc.screen.bottom() - box.getY());
                    }
                }
                collectIds(node, acc.excludeIds);
                break;
            default:
                break;
        }
    }

    static Optional<ChromeElement> classify(RawNode node, BoundingBox screen) {
        String name = node.getName() == null ? "" : node.getName().toLowerCase(Locale.ROOT);
        if (name.contains("safe") && name.contains("area")) {
            return Optional.of(ChromeElement.SAFE_AREA);
        }
        if (name.contains("status") && name.contains("bar")) {
            return Optional.of(ChromeElement.STATUS_BAR);
        }
        if (name.contains("home") && name.contains("indicator")) {
            return Optional.of(ChromeElement.HOME_INDICATOR);
        }
        if (name.contains("navigation") && name.contains("bar")) {
            return Optional.of(ChromeElement.NAVIGATION_BAR);
        }

        BoundingBox box = node.getBoundingBox();
        if (box == null || box.getWidth() < screen.getWidth() * FULL_WIDTH_RATIO) {
            return Optional.empty();
        }
        if (Math.abs(box.getY() - screen.getY()) <= EDGE_TOLERANCE
                && box.getHeight() >= STATUS_BAR_MIN_HEIGHT && box.getHeight() <= STATUS_BAR_MAX_HEIGHT
                && looksLikeStatusBarContent(node)) {
            return Optional.of(ChromeElement.STATUS_BAR);
        }
        if (Math.abs(box.bottom() - screen.bottom()) <= EDGE_TOLERANCE
                && box.getHeight() >= HOME_INDICATOR_MIN_HEIGHT && box.getHeight() <= HOME_INDICATOR_MAX_HEIGHT
                && looksLikeHomeIndicatorContent(node)) {
            return Optional.of(ChromeElement.HOME_INDICATOR);
        }
        return Optional.empty();
    }

    // A clock ("9:41") or battery/signal/wifi glyphs.
    private static boolean looksLikeStatusBarContent(RawNode node) {
        return anyDescendant(node, child -> {
            String name = child.getName() == null ? "" : child.getName().toLowerCase(Locale.ROOT);
            String text = child.getProperties().getText();
            return name.contains("battery") || name.contains("signal") || name.contains("wifi")
                    || name.contains("time") || text != null && text.trim().matches("\\d{1,2}:\\d{2}");
        });
    }

    // A single short pill centered at the bottom, or nothing at all.
    private static boolean looksLikeHomeIndicatorContent(RawNode node) {
        if (node.getChildren().isEmpty()) {
            return node.getProperties().getText() == null;
        }
        return node.getChildren().size() == 1 && node.getChildren().get(0).getChildren().isEmpty()
                && node.getChildren().get(0).boundsOrZero().getHeight() <= 8;
    }

    private static boolean anyDescendant(RawNode node, Predicate<RawNode> predicate) {
        for (RawNode child : node.getChildren()) {
            if (predicate.test(child) || anyDescendant(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isInUpperHalf(BoundingBox box, BoundingBox screen) {
        return box.getY() + box.getHeight() / 2 < screen.getY() + screen.getHeight() / 2;
    }

    private static void collectIds(RawNode node, List<String> ids) {
        ids.add(node.getId());
        for (RawNode child : node.getChildren()) {
            collectIds(child, ids);
        }
    }

    private static final class Accumulator {
        final BoundingBox screen;
        final Map<String, ChromeElement> elements = new LinkedHashMap<>();
        final List<String> excludeIds = new ArrayList<>();
        boolean hasSafeAreaFrame;
        double top;
        double bottom;
        double left;
        double right;

        Accumulator(BoundingBox screen) {
            this.screen = screen;
        }
    }
}

package com.designtool.lowering.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.RawNode;

/**
 * Drops nodes that should never reach code generation: explicitly excluded
 * ids, hidden nodes, device chrome and design annotations. A dropped node
 * takes its whole subtree with it.
 */
public class NodeFilter {

    private static final Logger log = LoggerFactory.getLogger(NodeFilter.class);

    private static final List<WildcardPattern> OS_COMPONENT_PATTERNS = List.of(
            "StatusBar",
            "Status Bar",
            "*StatusBar*",
            "Home Indicator",
            "*HomeIndicator*",
            "iPhone*Overlay",
            "iPhone*Frame",
            "Device Frame",
            "Device Overlay",
            "Navigation Bar",
            "NavigationBar",
            "System Bar",
            "SystemBar",
            "*Device Chrome*").stream().map(WildcardPattern::compile).toList();

    /**
     * Filters the tree rooted at {@code root}.
     *
     * @return the surviving tree, or {@code null} when the root itself is dropped
     */
    public NormalizedNode filter(RawNode root, FilterOptions options) {
        List<WildcardPattern> patterns = options.effectiveIgnorePatterns().stream()
                .map(WildcardPattern::compile)
                .toList();
        return filterNode(root, patterns, options.getExcludeIds());
    }

    /**
     * Returns the first reason, in priority order, for dropping {@code node}.
     */
    public Optional<FilterReason> shouldFilter(RawNode node, List<WildcardPattern> ignorePatterns,
                                               Set<String> excludeIds) {
        if (excludeIds.contains(node.getId())) {
            return Optional.of(FilterReason.EXCLUDED);
        }
        if (node.isHidden()) {
            return Optional.of(FilterReason.HIDDEN);
        }
        Optional<FilterReason> osReason = osComponentReason(node.getName());
        if (osReason.isPresent()) {
            return osReason;
        }
        for (WildcardPattern pattern : ignorePatterns) {
            if (pattern.matches(node.getName())) {
                return Optional.of(patternReason(pattern));
            }
        }
        return Optional.empty();
    }

    private NormalizedNode filterNode(RawNode node, List<WildcardPattern> patterns, Set<String> excludeIds) {
        Optional<FilterReason> reason = shouldFilter(node, patterns, excludeIds);
        if (reason.isPresent()) {
            log.debug("FILTERED node {} '{}' ({})", node.getId(), node.getName(), reason.get());
            return null;
        }

        List<NormalizedNode> children = new ArrayList<>();
        for (RawNode child : node.getChildren()) {
            NormalizedNode normalized = filterNode(child, patterns, excludeIds);
            if (normalized != null) {
                children.add(normalized);
            }
        }

        return NormalizedNode.builder()
                .id(node.getId())
                .name(node.getName())
                .type(node.getType())
                .boundingBox(node.boundsOrZero())
                .properties(node.getProperties())
                .children(children)
                .build();
    }

    static Optional<FilterReason> osComponentReason(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("status") && lower.contains("bar")) {
            return Optional.of(FilterReason.STATUS_BAR);
        }
        if (lower.contains("home") && lower.contains("indicator")) {
            return Optional.of(FilterReason.HOME_INDICATOR);
        }
        if (lower.contains("navigation") && lower.contains("bar")) {
            return Optional.of(FilterReason.OS_COMPONENT);
        }
        for (WildcardPattern pattern : OS_COMPONENT_PATTERNS) {
            if (pattern.matches(name)) {
                return Optional.of(FilterReason.OS_COMPONENT);
            }
        }
        return Optional.empty();
    }

    private static FilterReason patternReason(WildcardPattern pattern) {
        String source = pattern.getSource().toLowerCase(Locale.ROOT);
        if (source.contains("annotation")) {
            return FilterReason.ANNOTATION;
        }
        if (source.contains("measure")) {
            return FilterReason.MEASUREMENT;
        }
        return FilterReason.PATTERN_MATCH;
    }
}

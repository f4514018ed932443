package com.designtool.lowering.detection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.detection.InteractionState;
import com.designtool.lowering.model.detection.StateStyle;
import com.designtool.lowering.model.detection.VariantDetection;
import com.designtool.lowering.model.detection.VariantProperty;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.styles.ColorResolver;
import com.designtool.lowering.util.NamingUtil;

/**
 * Reads component sets: the variant properties encoded in variant names
 * ({@code State=Pressed, Size=Large}) and the interaction state each variant
 * represents, with the style it overrides relative to the default variant.
 */
public class VariantStateDetector {

    private static final Logger log = LoggerFactory.getLogger(VariantStateDetector.class);

    static final double DISABLED_OPACITY = 0.6;

    private static final Set<String> STATE_PROPERTY_NAMES = Set.of("state", "variant", "status");
    private static final Pattern DEFAULT_VALUE = Pattern.compile("(?i)default|normal|idle|enabled|rest");
    private static final Pattern LOADING_INDICATOR = Pattern.compile(".*(spinner|loader|loading).*");
    private static final Pattern ERROR_INDICATOR = Pattern.compile(".*(error|alert|warning).*");
    private static final Pattern SUCCESS_INDICATOR = Pattern.compile(".*(check|success).*");

    /**
     * Every component set in the tree, in document order.
     */
    public List<VariantDetection> detect(RawNode root) {
        List<VariantDetection> detections = new ArrayList<>();
        collect(root, detections);
        return detections;
    }

    private void collect(RawNode node, List<VariantDetection> detections) {
        if (node.getType() == NodeType.COMPONENT_SET) {
            detectComponentSet(node).ifPresent(detections::add);
            return;
        }
        for (RawNode child : node.getChildren()) {
            collect(child, detections);
        }
    }

    public Optional<VariantDetection> detectComponentSet(RawNode componentSet) {
        List<RawNode> variants = new ArrayList<>();
        List<Map<String, String>> variantProps = new ArrayList<>();
        for (RawNode child : componentSet.getChildren()) {
            if (child.getType() != NodeType.COMPONENT) {
                continue;
            }
            Map<String, String> props = parseVariantName(child.getName());
            if (!props.isEmpty()) {
                variants.add(child);
                variantProps.add(props);
            }
        }
        if (variants.isEmpty()) {
            return Optional.empty();
        }

        List<VariantProperty> properties = unionProperties(variantProps);
        int defaultIndex = defaultVariantIndex(variantProps);
        RawNode defaultVariant = variants.get(defaultIndex);

        List<StateStyle> states = new ArrayList<>();
        for (int i = 0; i < variants.size(); i++) {
            states.add(stateStyle(variants.get(i), variantProps.get(i), defaultVariant));
        }

        log.debug("COMPONENT SET {} '{}': {} variants, {} properties", componentSet.getId(),
                componentSet.getName(), variants.size(), properties.size());
        return Optional.of(new VariantDetection(componentSet.getId(),
                NamingUtil.toPascalCase(componentSet.getName()), properties, states));
    }

    /**
     * "State=Pressed, Size=Large" to an ordered map. Segments without '=' are skipped.
     */
    static Map<String, String> parseVariantName(String name) {
        Map<String, String> props = new LinkedHashMap<>();
        if (name == null) {
            return props;
        }
        for (String segment : name.split(",")) {
            int eq = segment.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = segment.substring(0, eq).trim();
            String value = segment.substring(eq + 1).trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                props.put(key, value);
            }
        }
        return props;
    }

    // Values sorted, with a default-looking value moved to the front.
    private static List<VariantProperty> unionProperties(List<Map<String, String>> variantProps) {
        Map<String, Set<String>> values = new LinkedHashMap<>();
        for (Map<String, String> props : variantProps) {
            props.forEach((key, value) -> values.computeIfAbsent(key, k -> new TreeSet<>()).add(value));
        }
        List<VariantProperty> properties = new ArrayList<>();
        values.forEach((key, set) -> {
            List<String> ordered = new ArrayList<>(set);
            ordered.stream().filter(v -> DEFAULT_VALUE.matcher(v).matches()).findFirst().ifPresent(v -> {
                ordered.remove(v);
                ordered.add(0, v);
            });
            properties.add(new VariantProperty(key, List.copyOf(ordered), ordered.get(0)));
        });
        return properties;
    }

    private static int defaultVariantIndex(List<Map<String, String>> variantProps) {
        for (int i = 0; i < variantProps.size(); i++) {
            for (Map.Entry<String, String> entry : variantProps.get(i).entrySet()) {
                if (isStateProperty(entry.getKey()) && DEFAULT_VALUE.matcher(entry.getValue()).matches()) {
                    return i;
                }
            }
        }
        return 0;
    }

    private StateStyle stateStyle(RawNode variant, Map<String, String> props, RawNode defaultVariant) {
        InteractionState state = keywordState(props).orElse(null);
        boolean loadingIndicator = hasDescendantNamed(variant, LOADING_INDICATOR);
        boolean errorIndicator = hasDescendantNamed(variant, ERROR_INDICATOR);
        boolean successIndicator = hasDescendantNamed(variant, SUCCESS_INDICATOR);
        double opacity = variant.getProperties().opacityOrDefault();

        if (state == null) {
            if (opacity <= DISABLED_OPACITY) {
                state = InteractionState.DISABLED;
            } else if (loadingIndicator) {
                state = InteractionState.LOADING;
            } else if (errorIndicator) {
                state = InteractionState.ERROR;
            } else {
                state = InteractionState.DEFAULT;
            }
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        if (variant != defaultVariant) {
            if (opacity < 1.0 && opacity != defaultVariant.getProperties().opacityOrDefault()) {
                overrides.put("opacity", String.valueOf(opacity));
            }
            String color = fillColor(variant);
            if (color != null && !color.equals(fillColor(defaultVariant))) {
                overrides.put("backgroundColor", color);
            }
        }

        return StateStyle.builder()
                .state(state)
                .variantName(variant.getName())
                .styleOverrides(overrides)
                .hasIndicator(loadingIndicator || errorIndicator || successIndicator)
                .build();
    }

    static Optional<InteractionState> keywordState(Map<String, String> props) {
        for (Map.Entry<String, String> entry : props.entrySet()) {
            if (!isStateProperty(entry.getKey())) {
                continue;
            }
            Optional<InteractionState> state = stateFromKeyword(entry.getValue());
            if (state.isPresent()) {
                return state;
            }
        }
        return Optional.empty();
    }

    static Optional<InteractionState> stateFromKeyword(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("press") || lower.contains("active")) {
            return Optional.of(InteractionState.PRESSED);
        }
        if (lower.contains("disable")) {
            return Optional.of(InteractionState.DISABLED);
        }
        if (lower.contains("load")) {
            return Optional.of(InteractionState.LOADING);
        }
        if (lower.contains("error") || lower.contains("invalid")) {
            return Optional.of(InteractionState.ERROR);
        }
        if (lower.contains("hover")) {
            return Optional.of(InteractionState.HOVER);
        }
        if (lower.contains("focus")) {
            return Optional.of(InteractionState.FOCUSED);
        }
        if (DEFAULT_VALUE.matcher(lower).matches()) {
            return Optional.of(InteractionState.DEFAULT);
        }
        return Optional.empty();
    }

    private static boolean isStateProperty(String name) {
        return STATE_PROPERTY_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    private static String fillColor(RawNode node) {
        return node.getProperties().firstSolidFill()
                .map(fill -> ColorResolver.resolveEffectiveColor(fill.getColor(), fill.getOpacity()))
                .orElse(null);
    }

    private static boolean hasDescendantNamed(RawNode node, Pattern pattern) {
        for (RawNode child : node.getChildren()) {
            String name = child.getName() == null ? "" : child.getName().toLowerCase(Locale.ROOT);
            if (pattern.matcher(name).matches() || hasDescendantNamed(child, pattern)) {
                return true;
            }
        }
        return false;
    }
}

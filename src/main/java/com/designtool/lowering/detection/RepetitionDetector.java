package com.designtool.lowering.detection;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.detection.ComponentHint;
import com.designtool.lowering.model.ir.ButtonIr;
import com.designtool.lowering.model.ir.CardIr;
import com.designtool.lowering.model.ir.ContainerIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.recognize.StyleRefNamer;
import com.designtool.lowering.util.NamingUtil;

/**
 * Finds structurally identical subtrees anywhere on the screen that could be
 * extracted into one reusable component, and records which texts differ
 * between the instances.
 */
public class RepetitionDetector {

    private static final Logger log = LoggerFactory.getLogger(RepetitionDetector.class);

    public static final int MIN_INSTANCES = 2;

    public List<ComponentHint> detect(IrNode root) {
        Map<String, List<IrNode>> byFingerprint = new LinkedHashMap<>();
        collect(root, byFingerprint);

        List<ComponentHint> hints = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, List<IrNode>> entry : byFingerprint.entrySet()) {
            List<IrNode> instances = entry.getValue();
            if (instances.size() < MIN_INSTANCES) {
                continue;
            }
            String name = NamingUtil.disambiguate(componentName(instances.get(0)), usedNames::contains);
            usedNames.add(name);
            hints.add(new ComponentHint(
                    name,
                    instances.stream().map(IrNode::getId).toList(),
                    propsVariations(instances)));
            log.debug("REPEATED {}: {} instances share fingerprint {}", name, instances.size(), entry.getKey());
        }
        return hints;
    }

    private void collect(IrNode node, Map<String, List<IrNode>> byFingerprint) {
        if (isCandidate(node)) {
            byFingerprint.computeIfAbsent(StructuralFingerprint.fingerprintOf(node), k -> new ArrayList<>()).add(node);
        }
        for (IrNode child : node.getChildren()) {
            collect(child, byFingerprint);
        }
    }

    private static boolean isCandidate(IrNode node) {
        if (node instanceof ButtonIr) {
            return true;
        }
        return (node instanceof ContainerIr || node instanceof CardIr) && !node.getChildren().isEmpty();
    }

    static String componentName(IrNode first) {
        String baseName = NamingUtil.stripTrailingDigits(first.getName());
        if (!StyleRefNamer.isGenericName(baseName)) {
            String pascal = NamingUtil.words(baseName).stream()
                    .filter(w -> w.length() >= 3)
                    .map(NamingUtil::toPascalCase)
                    .reduce("", String::concat);
            if (!pascal.isEmpty() && !Character.isDigit(pascal.charAt(0))) {
                return pascal;
            }
        }
        return switch (first.getSemanticType()) {
            case CARD -> "CardComponent";
            case CONTAINER -> "SectionComponent";
            case BUTTON -> "ActionButton";
            default -> "ExtractedComponent";
        };
    }

    /**
     * Values per structural position, in first-seen order. Every key seen in any
     * instance is kept, so positions with a constant value list a single entry.
     */
    static Map<String, List<String>> propsVariations(List<IrNode> instances) {
        Map<String, Set<String>> values = new LinkedHashMap<>();
        for (IrNode instance : instances) {
            variableProps(instance).forEach((key, value) ->
                    values.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value));
        }
        Map<String, List<String>> variations = new LinkedHashMap<>();
        values.forEach((key, set) -> variations.put(key, List.copyOf(set)));
        return variations;
    }

    /**
     * Text and label values keyed by position, e.g. {@code child0_child1_text}.
     */
    static Map<String, String> variableProps(IrNode node) {
        Map<String, String> props = new LinkedHashMap<>();
        if (node instanceof TextIr text) {
            if (text.getText() != null) {
                props.put("text", text.getText());
            }
        } else if (node instanceof ButtonIr button) {
            if (button.getLabel() != null) {
                props.put("label", button.getLabel());
            }
        } else if (node instanceof ContainerIr || node instanceof CardIr) {
            List<IrNode> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                String prefix = "child" + i + "_";
                variableProps(children.get(i)).forEach((key, value) -> props.put(prefix + key, value));
            }
        }
        return props;
    }
}

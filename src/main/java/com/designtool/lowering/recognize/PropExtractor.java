package com.designtool.lowering.recognize;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.designtool.lowering.model.ir.ComponentProp;
import com.designtool.lowering.model.ir.ImageIr;
import com.designtool.lowering.model.ir.IrNode;
import com.designtool.lowering.model.ir.RepeaterIr;
import com.designtool.lowering.model.ir.TextIr;
import com.designtool.lowering.util.NamingUtil;

/**
 * Derives the props of a component instance from the text and image nodes
 * inside it and binds each of those nodes to its prop.
 */
public class PropExtractor {

    public Map<String, ComponentProp> extract(List<IrNode> children) {
        Map<String, ComponentProp> props = new LinkedHashMap<>();
        Map<String, String> seen = new HashMap<>();
        for (IrNode child : children) {
            traverse(child, props, seen);
        }
        return props;
    }

    private void traverse(IrNode node, Map<String, ComponentProp> props, Map<String, String> seen) {
        if (node instanceof TextIr text && text.getText() != null && !text.getText().isEmpty()) {
            bind(node, text.getText(), ComponentProp.Type.STRING, propNameForText(node.getName()), props, seen);
            return;
        }
        if (node instanceof ImageIr image) {
            String ref = image.getImageRef() != null ? image.getImageRef() : "";
            bind(node, ref, ComponentProp.Type.IMAGE, NamingUtil.toValidIdentifier(nameOr(node, "image")),
                    props, seen);
            return;
        }
        // Repeater items are bound through the repeater's data prop.
        if (node instanceof RepeaterIr) {
            return;
        }
        for (IrNode child : node.getChildren()) {
            traverse(child, props, seen);
        }
    }

    private void bind(IrNode node, String value, ComponentProp.Type type, String baseName,
                      Map<String, ComponentProp> props, Map<String, String> seen) {
        String contentKey = nameOr(node, type.getValue()) + "|" + type.getValue() + "|" + value;
        String existing = seen.get(contentKey);
        if (existing != null) {
            node.assignPropName(existing);
            return;
        }

        String finalName = baseName;
        int counter = 1;
        while (props.containsKey(finalName) && !props.get(finalName).getDefaultValue().equals(value)) {
            finalName = baseName + counter++;
        }
        props.putIfAbsent(finalName, new ComponentProp(type, value));
        node.assignPropName(finalName);
        seen.put(contentKey, finalName);
    }

    static String propNameForText(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.contains("description") || lower.contains("subtitle") || lower.contains("body")) {
            return "description";
        }
        if (lower.contains("title") || lower.equals("header") || lower.equals("headline")) {
            return "title";
        }
        if (lower.equals("label") || lower.equals("placeholder")) {
            return lower;
        }
        if (lower.contains("price")) {
            return "price";
        }
        if (lower.contains("date") || lower.contains("time")) {
            return "dateTime";
        }
        return NamingUtil.toValidIdentifier(name == null || name.isEmpty() ? "text" : name);
    }

    private static String nameOr(IrNode node, String fallback) {
        return node.getName() != null && !node.getName().isEmpty() ? node.getName() : fallback;
    }
}

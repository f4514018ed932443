package com.designtool.lowering.recognize;

import java.util.regex.Pattern;

import com.designtool.lowering.model.layout.LayoutNode;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.util.NamingUtil;

/**
 * Picks the preferred style reference for a node. Collisions are resolved
 * later by the style registry.
 */
public class StyleRefNamer {

    // Names the design tool assigns automatically ("Frame 12", "Rectangle", "Union 3").
    private static final Pattern GENERIC_NAME = Pattern.compile(
            "^(Frame|Group|Rectangle|Vector|Star|Ellipse|Line|Polygon|Boolean|Union|Subtract|Intersect|Exclude"
                    + "|Component|Instance|Text|Slice|Image|Shape|Layer)\\s*\\d*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STYLE_NUMBER = Pattern.compile("^style\\d+$");

    public static boolean isGenericName(String name) {
        if (name == null || name.isBlank()) {
            return true;
        }
        return GENERIC_NAME.matcher(name.trim()).matches();
    }

    public String styleRefFor(LayoutNode node) {
        if (!isGenericName(node.getName())) {
            String identifier = NamingUtil.toValidIdentifier(node.getName());
            if (!"element".equals(identifier) && !STYLE_NUMBER.matcher(identifier).matches()) {
                return identifier;
            }
        }
        return prefixFor(node) + "_" + shortId(node.getId());
    }

    private static String prefixFor(LayoutNode node) {
        if (node.getType() == NodeType.TEXT) {
            return "text";
        }
        if (node.getType() == NodeType.VECTOR) {
            return "icon";
        }
        return node.hasChildren() ? "container" : "element";
    }

    /**
     * Last alphanumeric segment of the id, e.g. {@code 12} for {@code 1:12}.
     */
    static String shortId(String id) {
        if (id == null || id.isEmpty()) {
            return "node";
        }
        String safe = id.replaceAll("[^a-zA-Z0-9]", "_");
        String[] segments = safe.split("_");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                return segments[i];
            }
        }
        return safe;
    }
}

package com.designtool.lowering.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.raw.AutoLayout;
import com.designtool.lowering.model.raw.AxisSizingMode;
import com.designtool.lowering.model.raw.BoundingBox;
import com.designtool.lowering.model.raw.Constraints;
import com.designtool.lowering.model.raw.CornerRadius;
import com.designtool.lowering.model.raw.Effect;
import com.designtool.lowering.model.raw.EffectType;
import com.designtool.lowering.model.raw.GradientFill;
import com.designtool.lowering.model.raw.GradientStop;
import com.designtool.lowering.model.raw.GradientType;
import com.designtool.lowering.model.raw.HorizontalConstraint;
import com.designtool.lowering.model.raw.ImageFill;
import com.designtool.lowering.model.raw.LayoutAlign;
import com.designtool.lowering.model.raw.LayoutMode;
import com.designtool.lowering.model.raw.LayoutPositioning;
import com.designtool.lowering.model.raw.NodeProperties;
import com.designtool.lowering.model.raw.NodeType;
import com.designtool.lowering.model.raw.OverflowDirection;
import com.designtool.lowering.model.raw.Padding;
import com.designtool.lowering.model.raw.RawNode;
import com.designtool.lowering.model.raw.RgbaColor;
import com.designtool.lowering.model.raw.SolidFill;
import com.designtool.lowering.model.raw.Stroke;
import com.designtool.lowering.model.raw.Typography;
import com.designtool.lowering.model.raw.VerticalConstraint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads design-tool JSON exports into {@link RawNode} trees.
 *
 * Accepts either a bare node or a nodes-endpoint envelope
 * ({@code {"nodes": {"<id>": {"document": {...}}}}}), in which case the first
 * document is read. Missing or unrecognized fields are treated as absent.
 */
public class RawNodeReader {
    private static final Logger log = LoggerFactory.getLogger(RawNodeReader.class);

    private final ObjectMapper objectMapper;

    public RawNodeReader() {
        this(new ObjectMapper());
    }

    public RawNodeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RawNode read(Path path) throws IOException {
        log.debug("Reading design export {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public RawNode read(InputStream in) throws IOException {
        return toRawNode(unwrapEnvelope(objectMapper.readTree(in)));
    }

    public RawNode readString(String json) throws IOException {
        return toRawNode(unwrapEnvelope(objectMapper.readTree(json)));
    }

    private static JsonNode unwrapEnvelope(JsonNode json) throws IOException {
        if (json == null || !json.isObject()) {
            throw new IOException("Expected a JSON object at the top level");
        }
        JsonNode nodes = json.get("nodes");
        if (nodes != null && nodes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = nodes.fields();
            if (!it.hasNext()) {
                throw new IOException("Envelope contains no nodes");
            }
            Map.Entry<String, JsonNode> first = it.next();
            JsonNode document = first.getValue().get("document");
            if (document == null || !document.isObject()) {
                throw new IOException("Envelope entry " + first.getKey() + " has no document");
            }
            return document;
        }
        if (json.has("document") && json.get("document").isObject()) {
            return json.get("document");
        }
        return json;
    }

    RawNode toRawNode(JsonNode json) {
        RawNode.RawNodeBuilder builder = RawNode.builder()
                .id(text(json, "id", ""))
                .name(text(json, "name", ""))
                .type(NodeType.of(text(json, "type", null)))
                .boundingBox(boundingBox(json))
                .properties(properties(json));
        JsonNode visible = json.get("visible");
        if (visible != null && visible.isBoolean()) {
            builder.visible(visible.booleanValue());
        }
        JsonNode children = json.get("children");
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                if (child.isObject()) {
                    builder.child(toRawNode(child));
                }
            }
        }
        return builder.build();
    }

    private static BoundingBox boundingBox(JsonNode json) {
        JsonNode box = json.has("absoluteBoundingBox") ? json.get("absoluteBoundingBox") : json.get("boundingBox");
        if (box == null || !box.isObject()) {
            return null;
        }
        return new BoundingBox(number(box, "x", 0), number(box, "y", 0),
                number(box, "width", 0), number(box, "height", 0));
    }

    private static NodeProperties properties(JsonNode json) {
        NodeProperties.NodePropertiesBuilder props = NodeProperties.builder();

        for (JsonNode paint : array(json, "fills")) {
            if (!isVisible(paint)) {
                continue;
            }
            readFill(paint, props);
        }
        double strokeWeight = number(json, "strokeWeight", 1);
        String strokeAlign = text(json, "strokeAlign", null);
        for (JsonNode paint : array(json, "strokes")) {
            if (isVisible(paint) && "SOLID".equals(text(paint, "type", null)) && paint.has("color")) {
                props.stroke(new Stroke(color(paint.get("color")), strokeWeight, number(paint, "opacity", 1),
                        strokeAlign));
            }
        }
        for (JsonNode effect : array(json, "effects")) {
            if (!isVisible(effect)) {
                continue;
            }
            EffectType type = enumValue(EffectType.class, text(effect, "type", null));
            if (type == null) {
                continue;
            }
            JsonNode offset = effect.get("offset");
            props.effect(Effect.builder()
                    .type(type)
                    .color(effect.has("color") ? color(effect.get("color")) : null)
                    .offsetX(offset != null ? number(offset, "x", 0) : 0)
                    .offsetY(offset != null ? number(offset, "y", 0) : 0)
                    .radius(number(effect, "radius", 0))
                    .spread(number(effect, "spread", 0))
                    .build());
        }

        props.cornerRadius(cornerRadius(json));
        if (json.has("opacity") && json.get("opacity").isNumber()) {
            props.opacity(json.get("opacity").doubleValue());
        }
        props.text(text(json, "characters", null));
        props.typography(typography(json.get("style")));

        LayoutMode mode = enumValue(LayoutMode.class, text(json, "layoutMode", null));
        if (mode != null) {
            props.autoLayout(AutoLayout.builder()
                    .mode(mode)
                    .gap(optionalNumber(json, "itemSpacing"))
                    .padding(new Padding(number(json, "paddingTop", 0), number(json, "paddingRight", 0),
                            number(json, "paddingBottom", 0), number(json, "paddingLeft", 0)))
                    .mainAxisAlign(text(json, "primaryAxisAlignItems", null))
                    .crossAxisAlign(text(json, "counterAxisAlignItems", null))
                    .wrap("WRAP".equals(text(json, "layoutWrap", null)))
                    .build());
        }
        props.primaryAxisSizingMode(enumValue(AxisSizingMode.class, text(json, "primaryAxisSizingMode", null)));
        props.counterAxisSizingMode(enumValue(AxisSizingMode.class, text(json, "counterAxisSizingMode", null)));
        props.layoutAlign(enumValue(LayoutAlign.class, text(json, "layoutAlign", null)));
        props.layoutGrow(optionalNumber(json, "layoutGrow"));
        props.layoutPositioning(enumValue(LayoutPositioning.class, text(json, "layoutPositioning", null)));
        props.overflowDirection(enumValue(OverflowDirection.class, text(json, "overflowDirection", null)));

        JsonNode constraints = json.get("constraints");
        if (constraints != null && constraints.isObject()) {
            props.constraints(new Constraints(
                    enumValue(HorizontalConstraint.class, text(constraints, "horizontal", null)),
                    enumValue(VerticalConstraint.class, text(constraints, "vertical", null))));
        }

        props.componentId(text(json, "componentId", null));
        JsonNode componentProperties = json.get("componentProperties");
        if (componentProperties != null && componentProperties.isObject()) {
            componentProperties.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue().isObject() ? entry.getValue().get("value") : entry.getValue();
                if (value != null && value.isValueNode()) {
                    props.variantProperty(entry.getKey(), value.asText());
                }
            });
        }
        return props.build();
    }

    private static void readFill(JsonNode paint, NodeProperties.NodePropertiesBuilder props) {
        String type = text(paint, "type", "");
        double opacity = number(paint, "opacity", 1);
        if ("SOLID".equals(type) && paint.has("color")) {
            props.fill(new SolidFill(color(paint.get("color")), opacity));
        } else if ("IMAGE".equals(type)) {
            props.fill(new ImageFill(text(paint, "imageRef", null), text(paint, "scaleMode", null), opacity));
        } else if (type.startsWith("GRADIENT_")) {
            GradientType gradientType = enumValue(GradientType.class, type.substring("GRADIENT_".length()));
            if (gradientType == null) {
                return;
            }
            GradientFill.GradientFillBuilder gradient = GradientFill.builder()
                    .gradientType(gradientType)
                    .angle(gradientType == GradientType.LINEAR ? gradientAngle(paint) : null)
                    .opacity(opacity);
            for (JsonNode stop : array(paint, "gradientStops")) {
                if (stop.has("color")) {
                    gradient.stop(new GradientStop(number(stop, "position", 0), color(stop.get("color"))));
                }
            }
            props.fill(gradient.build());
        }
    }

    // Handle positions are normalized; 0 degrees points up as in CSS.
    private static Double gradientAngle(JsonNode paint) {
        JsonNode handles = paint.get("gradientHandlePositions");
        if (handles == null || !handles.isArray() || handles.size() < 2) {
            return null;
        }
        double dx = number(handles.get(1), "x", 0) - number(handles.get(0), "x", 0);
        double dy = number(handles.get(1), "y", 0) - number(handles.get(0), "y", 0);
        double degrees = Math.toDegrees(Math.atan2(dy, dx)) + 90;
        return (double) Math.round(((degrees % 360) + 360) % 360);
    }

    private static CornerRadius cornerRadius(JsonNode json) {
        JsonNode radii = json.get("rectangleCornerRadii");
        if (radii != null && radii.isArray() && radii.size() == 4) {
            return new CornerRadius(radii.get(0).asDouble(), radii.get(1).asDouble(),
                    radii.get(2).asDouble(), radii.get(3).asDouble());
        }
        Double radius = optionalNumber(json, "cornerRadius");
        return radius != null ? CornerRadius.uniform(radius) : null;
    }

    private static Typography typography(JsonNode style) {
        if (style == null || !style.isObject()) {
            return null;
        }
        return Typography.builder()
                .fontFamily(text(style, "fontFamily", null))
                .fontSize(number(style, "fontSize", 0))
                .fontWeight((int) number(style, "fontWeight", 400))
                .lineHeight(optionalNumber(style, "lineHeightPx"))
                .letterSpacing(optionalNumber(style, "letterSpacing"))
                .textAlign(text(style, "textAlignHorizontal", null))
                .textDecoration(text(style, "textDecoration", null))
                .textCase(text(style, "textCase", null))
                .build();
    }

    /**
     * Channels arrive as 0-1 floats.
     */
    static RgbaColor color(JsonNode color) {
        return new RgbaColor(channel(color, "r"), channel(color, "g"), channel(color, "b"), number(color, "a", 1));
    }

    private static int channel(JsonNode color, String field) {
        return (int) Math.round(Math.max(0, Math.min(1, number(color, field, 0))) * 255);
    }

    private static boolean isVisible(JsonNode json) {
        JsonNode visible = json.get("visible");
        return visible == null || !visible.isBoolean() || visible.booleanValue();
    }

    private static Iterable<JsonNode> array(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        return value;
    }

    private static String text(JsonNode json, String field, String defaultValue) {
        JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.textValue() : defaultValue;
    }

    private static double number(JsonNode json, String field, double defaultValue) {
        JsonNode value = json.get(field);
        return value != null && value.isNumber() ? value.doubleValue() : defaultValue;
    }

    private static Double optionalNumber(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && value.isNumber() ? value.doubleValue() : null;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unknown {} value '{}'", type.getSimpleName(), value);
            return null;
        }
    }
}

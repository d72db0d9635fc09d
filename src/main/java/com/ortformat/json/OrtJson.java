package com.ortformat.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ortformat.model.OrtValue;

/**
 * Converts between {@link OrtValue} trees and Jackson {@link JsonNode} trees.
 *
 * <p>JSON numbers all become doubles. On the way out, integral doubles that fit a long
 * are written as integers, and NaN and the infinities, which JSON cannot carry, become
 * {@code null}. Key order is preserved in both directions.
 */
public final class OrtJson {

    /** Largest magnitude up to which every integral double is exact as a long. */
    private static final double EXACT_LONG_LIMIT = 9.007199254740992E15;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private OrtJson() {
    }

    public static OrtValue fromJson(String json) throws JsonProcessingException {
        return fromJsonNode(MAPPER.readTree(json));
    }

    public static String toJson(OrtValue value, boolean pretty) throws JsonProcessingException {
        JsonNode node = toJsonNode(value);
        return pretty
                ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                : MAPPER.writeValueAsString(node);
    }

    public static OrtValue fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OrtValue.ofNull();
        }
        if (node.isBoolean()) {
            return OrtValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return OrtValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return OrtValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<OrtValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJsonNode(item));
            }
            return OrtValue.of(items);
        }
        if (node.isObject()) {
            OrtValue object = OrtValue.emptyObject();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.set(field.getKey(), fromJsonNode(field.getValue()));
            }
            return object;
        }
        // binary and POJO nodes only arise from programmatic trees
        return OrtValue.of(node.asText());
    }

    public static JsonNode toJsonNode(OrtValue value) {
        return switch (value.getType()) {
            case NULL -> NODES.nullNode();
            case BOOL -> NODES.booleanNode(value.asBool().orElseThrow());
            case NUMBER -> numberNode(value.asNumber().orElseThrow());
            case STRING -> NODES.textNode(value.asString().orElseThrow());
            case ARRAY -> {
                ArrayNode array = NODES.arrayNode();
                value.asArray().orElseThrow().forEach(item -> array.add(toJsonNode(item)));
                yield array;
            }
            case OBJECT -> {
                ObjectNode object = NODES.objectNode();
                value.asObject().orElseThrow().forEach((k, v) -> object.set(k, toJsonNode(v)));
                yield object;
            }
        };
    }

    private static JsonNode numberNode(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return NODES.nullNode();
        }
        if (d == Math.rint(d) && Math.abs(d) <= EXACT_LONG_LIMIT) {
            return NODES.numberNode((long) d);
        }
        return NODES.numberNode(d);
    }
}

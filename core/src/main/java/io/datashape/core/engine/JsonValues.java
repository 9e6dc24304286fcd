package io.datashape.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datashape.core.model.Undefined;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Jackson trees into the plain value model the parser works on.
 *
 * <ul>
 *   <li>objects become {@link LinkedHashMap}s in field order
 *   <li>arrays become {@link ArrayList}s
 *   <li>numbers keep Jackson's numeric type ({@code int}, {@code long}, {@code BigInteger},
 *       {@code double}, {@code BigDecimal})
 *   <li>{@code null} stays {@code null}; a missing node becomes {@link Undefined#INSTANCE}
 * </ul>
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {}

    public static Object toPlain(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return Undefined.INSTANCE;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toPlain(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(element -> list.add(toPlain(element)));
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBinary()) {
            return MAPPER.convertValue(node, byte[].class);
        }
        return MAPPER.convertValue(node, Object.class);
    }

    /**
     * Renders a parse output as JSON. Absent markers are dropped from objects and become
     * {@code null} elsewhere; instants are rendered as ISO-8601 strings.
     */
    public static JsonNode toJson(Object value) {
        return MAPPER.valueToTree(stripUndefined(value));
    }

    private static Object stripUndefined(Object value) {
        if (value == Undefined.INSTANCE) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (v != Undefined.INSTANCE) {
                    out.put(String.valueOf(k), stripUndefined(v));
                }
            });
            return out;
        }
        if (value instanceof Iterable<?> items) {
            List<Object> out = new ArrayList<>();
            items.forEach(v -> out.add(stripUndefined(v)));
            return out;
        }
        return value;
    }
}

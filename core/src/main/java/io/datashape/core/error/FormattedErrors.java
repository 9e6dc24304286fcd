package io.datashape.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error tree mirroring the shape of the input. Each node holds the messages reported exactly at its
 * path (rendered as {@code _errors}) plus one child per nested path segment.
 */
public final class FormattedErrors {

    public static final String ERRORS_KEY = "_errors";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> errors = new ArrayList<>();
    private final Map<String, FormattedErrors> children = new LinkedHashMap<>();

    FormattedErrors() {}

    void add(List<Object> path, String message) {
        FormattedErrors node = this;
        for (Object segment : path) {
            node = node.children.computeIfAbsent(String.valueOf(segment), k -> new FormattedErrors());
        }
        node.errors.add(message);
    }

    /** Messages reported at this node's path. */
    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Child nodes keyed by path segment; indices are rendered as strings. */
    public Map<String, FormattedErrors> children() {
        return Collections.unmodifiableMap(children);
    }

    /** The child for {@code segment}, or {@code null} if nothing was reported beneath it. */
    public FormattedErrors get(Object segment) {
        return children.get(String.valueOf(segment));
    }

    /** Renders the tree as {@code {"_errors": [...], "<segment>": {...}}}. */
    public JsonNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode list = node.putArray(ERRORS_KEY);
        errors.forEach(list::add);
        children.forEach((segment, child) -> node.set(segment, child.toJson()));
        return node;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}

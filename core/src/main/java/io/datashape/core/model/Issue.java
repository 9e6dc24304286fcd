package io.datashape.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single validation failure.
 *
 * <p>Issues are created with a {@code null} message and resolved once through the error-map layers;
 * {@link #withMessage(String)} produces the final record.
 *
 * @param kind    failure kind
 * @param payload kind-specific data
 * @param path    location of the failing value; integers are indices, other segments are keys
 *                (a record or map key may be {@code null})
 * @param input   the offending data and its classification
 * @param type    the node that reported the issue
 * @param id      unique issue identifier
 * @param timestamp creation time in epoch milliseconds
 * @param message resolved human-readable message
 */
public record Issue(
        IssueKind kind,
        IssuePayload payload,
        List<Object> path,
        Input input,
        Type type,
        String id,
        long timestamp,
        String message) {

    public Issue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    /** Creates an unresolved issue with a fresh id and the current timestamp. */
    public static Issue create(IssueKind kind, IssuePayload payload, List<Object> path, Input input, Type type) {
        return new Issue(
                kind, payload, path, input, type, UUID.randomUUID().toString(), System.currentTimeMillis(), null);
    }

    public Issue withMessage(String resolved) {
        return new Issue(kind, payload, path, input, type, id, timestamp, resolved);
    }

    /** Dotted rendering of the path, e.g. {@code items[2].name}; empty for the root. */
    public String formattedPath() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : path) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                if (!sb.isEmpty()) {
                    sb.append('.');
                }
                sb.append(segment);
            }
        }
        return sb.toString();
    }

    /** The offending data. {@code data} may be {@link Undefined#INSTANCE} or {@code null}. */
    public record Input(Object data, ParsedType parsedType) {}

    /** Type tag and hint of the reporting node. */
    public record Type(TypeName name, String hint) {}
}

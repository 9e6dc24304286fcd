package io.datashape.core.schema;

import io.datashape.core.model.IssuePayload;
import java.util.Map;

/**
 * Produces the payload of the {@code CUSTOM} issue a failed refinement reports, optionally from the
 * rejected value.
 *
 * @param <T> type of the validated value
 */
@FunctionalInterface
public interface RefineMessage<T> {

    IssuePayload.Custom describe(T value);

    /** A fixed message; {@code null} falls back to the error-map layers. */
    static RefineMessage<Object> of(String message) {
        IssuePayload.Custom payload = IssuePayload.Custom.of(message);
        return value -> payload;
    }

    /** A fixed message with structured parameters. */
    static RefineMessage<Object> of(String message, Map<String, Object> params) {
        IssuePayload.Custom payload = new IssuePayload.Custom(message, params);
        return value -> payload;
    }
}

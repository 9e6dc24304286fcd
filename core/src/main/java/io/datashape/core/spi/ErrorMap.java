package io.datashape.core.spi;

import io.datashape.core.model.Issue;
import java.util.Map;

/**
 * Resolves a human-readable message for an issue.
 *
 * <p>Error maps are layered: the built-in defaults first, then the global map, the schema-level
 * map and finally the map passed at the call site. Each layer receives the message produced by the
 * layers below it as {@link ErrorMapContext#defaultMessage()}; returning {@code null} or an empty
 * string keeps that message.
 *
 * <p>Implementations must be thread-safe.
 */
@FunctionalInterface
public interface ErrorMap {

    /**
     * @param issue the issue, with its message not yet resolved
     * @param context the message resolved so far
     * @return the message for this layer, or {@code null} to defer
     */
    String message(Issue issue, ErrorMapContext context);

    /**
     * Builds a dictionary-style map keyed by issue code ({@code invalid_type}) or enum name
     * ({@code INVALID_TYPE}), with an optional {@code __default} entry for every other kind. Values
     * are either literal strings or nested {@link ErrorMap}s.
     *
     * @throws IllegalArgumentException if a key names no issue kind or a value has another type
     */
    static ErrorMap fromDictionary(Map<String, ?> entries) {
        return new DictionaryErrorMap(entries);
    }

    /** Context passed to each error-map layer. */
    record ErrorMapContext(String defaultMessage) {}
}

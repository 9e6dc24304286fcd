package io.datashape.core.spi;

import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import java.util.EnumMap;
import java.util.Map;

/** {@link ErrorMap} backed by a fixed entry per issue kind. */
final class DictionaryErrorMap implements ErrorMap {

    static final String DEFAULT_KEY = "__default";

    private final Map<IssueKind, ErrorMap> entries;
    private final ErrorMap fallback;

    DictionaryErrorMap(Map<String, ?> source) {
        Map<IssueKind, ErrorMap> resolved = new EnumMap<>(IssueKind.class);
        ErrorMap defaultEntry = null;
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            ErrorMap value = toErrorMap(entry.getKey(), entry.getValue());
            if (DEFAULT_KEY.equals(entry.getKey())) {
                defaultEntry = value;
            } else {
                resolved.put(IssueKind.fromCode(entry.getKey()), value);
            }
        }
        this.entries = resolved;
        this.fallback = defaultEntry;
    }

    private static ErrorMap toErrorMap(String key, Object value) {
        if (value instanceof ErrorMap map) {
            return map;
        }
        if (value instanceof String message) {
            return (issue, context) -> message;
        }
        throw new IllegalArgumentException("Error map entry '" + key + "' must be a string or an ErrorMap");
    }

    @Override
    public String message(Issue issue, ErrorMapContext context) {
        ErrorMap entry = entries.getOrDefault(issue.kind(), fallback);
        return entry != null ? entry.message(issue, context) : null;
    }

    @Override
    public String toString() {
        return "DictionaryErrorMap" + entries.keySet();
    }
}

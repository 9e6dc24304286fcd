package io.datashape.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-level error summary: messages of root-level issues, and messages grouped by the first path
 * segment.
 */
public record FlattenedErrors(List<String> formErrors, Map<String, List<String>> fieldErrors) {

    public FlattenedErrors {
        formErrors = List.copyOf(formErrors);
        fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }
}

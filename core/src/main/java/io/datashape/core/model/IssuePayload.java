package io.datashape.core.model;

import io.datashape.core.error.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kind-specific issue data. Each {@link IssueKind} maps to exactly one payload shape; checks and
 * custom refinements may carry their own message, which {@link #message()} exposes.
 */
public sealed interface IssuePayload {

    /** Payload-supplied message that overrides every error map, or {@code null}. */
    default String message() {
        return null;
    }

    /** No extra data ({@code REQUIRED}, {@code INVALID_INTERSECTION}, {@code FORBIDDEN}). */
    record None() implements IssuePayload {
        public static final None INSTANCE = new None();
    }

    record InvalidType(ParsedType expected, ParsedType received) implements IssuePayload {
        public InvalidType {
            Objects.requireNonNull(expected, "expected must not be null");
            Objects.requireNonNull(received, "received must not be null");
        }
    }

    /** A failed {@link Check}: array, set, tuple and date issues. */
    record CheckFailed(Check check) implements IssuePayload {
        public CheckFailed {
            Objects.requireNonNull(check, "check must not be null");
        }

        @Override
        public String message() {
            return check.message();
        }
    }

    record InvalidEnumValue(List<Object> expected, String expectedFormatted, Object received, String receivedFormatted)
            implements IssuePayload {
        public InvalidEnumValue {
            expected = List.copyOf(expected);
        }
    }

    record InvalidLiteral(Object expected, String expectedFormatted, Object received, String receivedFormatted)
            implements IssuePayload {}

    /** Wraps the validation failure of function arguments or a function return value. */
    record NestedError(ValidationException error) implements IssuePayload {
        public NestedError {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /** Issues of every union member, in member order. */
    record InvalidUnion(List<Issue> unionIssues) implements IssuePayload {
        public InvalidUnion {
            unionIssues = List.copyOf(unionIssues);
        }
    }

    record InvalidInstance(String className) implements IssuePayload {}

    record UnrecognizedKeys(List<String> keys) implements IssuePayload {
        public UnrecognizedKeys {
            keys = List.copyOf(keys);
        }
    }

    /** Payload of a refinement failure or a user-added issue. */
    record Custom(String message, Map<String, Object> params) implements IssuePayload {
        public Custom {
            params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        }

        public static Custom of(String message) {
            return new Custom(message, Map.of());
        }
    }
}

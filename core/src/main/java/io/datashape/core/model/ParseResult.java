package io.datashape.core.model;

import io.datashape.core.error.ValidationException;
import java.util.Objects;

/**
 * Outcome of a safe parse: either the validated (possibly transformed) output or the error holding
 * every collected issue.
 *
 * @param <T> output type
 */
public sealed interface ParseResult<T> {

    boolean ok();

    /** The output value. Only meaningful when {@link #ok()} is {@code true}. */
    T data();

    /** The validation error. Only non-null when {@link #ok()} is {@code false}. */
    ValidationException error();

    /** Returns the output, throwing the validation error on failure. */
    default T orElseThrow() {
        if (!ok()) {
            throw error();
        }
        return data();
    }

    static <T> ParseResult<T> success(T data) {
        return new Success<>(data);
    }

    static <T> ParseResult<T> failure(ValidationException error) {
        return new Failure<>(error);
    }

    record Success<T>(T data) implements ParseResult<T> {
        @Override
        public boolean ok() {
            return true;
        }

        @Override
        public ValidationException error() {
            return null;
        }
    }

    record Failure<T>(ValidationException error) implements ParseResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean ok() {
            return false;
        }

        @Override
        public T data() {
            return null;
        }
    }
}

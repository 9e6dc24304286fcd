package io.datashape.core.model;

import io.datashape.core.error.SchemaDefinitionException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Objects;

/**
 * A date check boundary: either a fixed instant or "now", which is resolved against a clock every
 * time the check runs.
 *
 * @param instant the fixed instant, or {@code null} for "now"
 */
public record DateBound(Instant instant) {

    /** Boundary that always resolves to the current instant. */
    public static final DateBound NOW = new DateBound(null);

    public static DateBound of(Instant instant) {
        return new DateBound(Objects.requireNonNull(instant, "instant must not be null"));
    }

    /**
     * Converts a user-supplied boundary. Accepts {@link Instant}, {@link Date}, epoch milliseconds,
     * an ISO-8601 string, or the literal string {@code "now"}.
     *
     * @throws SchemaDefinitionException if the value cannot be interpreted as a date
     */
    public static DateBound from(Object value) {
        if (value instanceof DateBound bound) {
            return bound;
        }
        if (value instanceof Instant instant) {
            return of(instant);
        }
        if (value instanceof Date date) {
            return of(date.toInstant());
        }
        if (value instanceof Number number) {
            return of(Instant.ofEpochMilli(number.longValue()));
        }
        if ("now".equals(value)) {
            return NOW;
        }
        if (value instanceof String text) {
            try {
                return of(Instant.parse(text));
            } catch (DateTimeParseException e) {
                throw new SchemaDefinitionException("Invalid date boundary: '" + text + "'", e);
            }
        }
        throw new SchemaDefinitionException("Unsupported date boundary: " + value);
    }

    public boolean isNow() {
        return instant == null;
    }

    /** Resolves this boundary to a concrete instant. */
    public Instant resolve(Clock clock) {
        return instant != null ? instant : clock.instant();
    }

    @Override
    public String toString() {
        return instant != null ? instant.toString() : "now";
    }
}

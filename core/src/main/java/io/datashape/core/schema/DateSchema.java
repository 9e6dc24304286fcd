package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Values;
import io.datashape.core.model.Check;
import io.datashape.core.model.DateBound;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Date node. Outputs {@link Instant}; {@link java.util.Date} input is normalized.
 *
 * <p>{@code min}, {@code max} and {@code range} are mutually exclusive with each other's
 * complement: adding a range clears both bounds and adding a bound clears the range.
 */
public final class DateSchema extends Schema<Instant> {

    /** Which raw inputs are converted to dates before the type check. */
    public enum Coercion {
        NONE,
        STRINGS,
        NUMBERS,
        ALL;

        boolean strings() {
            return this == STRINGS || this == ALL;
        }

        boolean numbers() {
            return this == NUMBERS || this == ALL;
        }
    }

    private final Coercion coercion;
    private final List<Check> checks;
    private final Clock clock;

    DateSchema(Coercion coercion, List<Check> checks, Clock clock, SchemaOptions options) {
        super(options);
        this.coercion = coercion;
        this.checks = checks;
        this.clock = clock;
    }

    public DateSchema coerce(Coercion policy) {
        return new DateSchema(policy, checks, clock, options());
    }

    /** Clock used to resolve {@code "now"} bounds. */
    public DateSchema clock(Clock value) {
        return new DateSchema(coercion, checks, value, options());
    }

    /** Inclusive lower bound: an {@link Instant}, {@link java.util.Date}, epoch millis, ISO string or {@code "now"}. */
    public DateSchema min(Object bound) {
        return min(bound, true, null);
    }

    public DateSchema min(Object bound, boolean inclusive, String message) {
        return addCheck(new Check.Min<>(DateBound.from(bound), inclusive, message), Set.of("range"));
    }

    /** Inclusive upper bound. */
    public DateSchema max(Object bound) {
        return max(bound, true, null);
    }

    public DateSchema max(Object bound, boolean inclusive, String message) {
        return addCheck(new Check.Max<>(DateBound.from(bound), inclusive, message), Set.of("range"));
    }

    /** Two-sided bound, inclusive on both ends. */
    public DateSchema range(Object min, Object max) {
        return range(min, max, Check.RangeInclusive.BOTH, null);
    }

    public DateSchema range(Object min, Object max, Check.RangeInclusive inclusive, String message) {
        return addCheck(
                new Check.Range<>(DateBound.from(min), DateBound.from(max), inclusive, message), Set.of("min", "max"));
    }

    public List<Check> checks() {
        return checks;
    }

    private DateSchema addCheck(Check check, Set<String> cleared) {
        return new DateSchema(coercion, Check.add(checks, check, cleared), clock, options());
    }

    @Override
    public TypeName typeName() {
        return TypeName.DATE;
    }

    @Override
    public String hint() {
        return "Date";
    }

    @Override
    CompletableFuture<ParseResult<Instant>> doParse(ParseContext ctx) {
        Object data = coerce(ctx.rawData());
        if (ParsedType.of(data) != ParsedType.DATE) {
            ctx.setData(data);
            ctx.invalidType(ParsedType.DATE);
            return ctx.abort();
        }
        Instant instant = Values.toInstant(data);
        ctx.setData(instant);
        for (Check check : checks) {
            if (!passes(check, instant)) {
                ctx.checkFailed(IssueKind.INVALID_DATE, check);
                if (ctx.abortEarly()) {
                    return ctx.abort();
                }
            }
        }
        return ctx.result(instant);
    }

    private Object coerce(Object data) {
        if (data instanceof String text && coercion.strings()) {
            Instant parsed = parseInstant(text);
            return parsed != null ? parsed : data;
        }
        if (data instanceof Number number && coercion.numbers() && !Values.isNaN(number)) {
            return Instant.ofEpochMilli(number.longValue());
        }
        return data;
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // try the next format
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // try the next format
        }
        try {
            return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private boolean passes(Check check, Instant value) {
        if (check instanceof Check.Min<?> min) {
            Instant bound = ((DateBound) min.value()).resolve(clock);
            return min.inclusive() ? !value.isBefore(bound) : value.isAfter(bound);
        }
        if (check instanceof Check.Max<?> max) {
            Instant bound = ((DateBound) max.value()).resolve(clock);
            return max.inclusive() ? !value.isAfter(bound) : value.isBefore(bound);
        }
        if (check instanceof Check.Range<?> range) {
            Instant low = ((DateBound) range.min()).resolve(clock);
            Instant high = ((DateBound) range.max()).resolve(clock);
            boolean aboveLow = range.inclusive().includesMin() ? !value.isBefore(low) : value.isAfter(low);
            boolean belowHigh = range.inclusive().includesMax() ? !value.isAfter(high) : value.isBefore(high);
            return aboveLow && belowHigh;
        }
        return true;
    }

    @Override
    DateSchema withOptions(SchemaOptions next) {
        return new DateSchema(coercion, checks, clock, next);
    }
}

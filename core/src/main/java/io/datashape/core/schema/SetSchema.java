package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.model.Check;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Validates every element of a {@link Set} in iteration order. Output is an insertion-ordered set;
 * elements are addressed by their iteration index in issue paths.
 *
 * @param <E> element output type
 */
public final class SetSchema<E> extends Schema<Set<E>> {

    private final Schema<E> element;
    private final List<Check> checks;

    SetSchema(Schema<E> element, List<Check> checks, SchemaOptions options) {
        super(options);
        this.element = element;
        this.checks = checks;
    }

    public Schema<E> element() {
        return element;
    }

    public List<Check> checks() {
        return checks;
    }

    public SetSchema<E> min(int value) {
        return min(value, null);
    }

    public SetSchema<E> min(int value, String message) {
        return min(value, true, message);
    }

    /** Lower bound on the element count; an exclusive bound rejects a count equal to {@code value}. */
    public SetSchema<E> min(int value, boolean inclusive, String message) {
        Check.requireSize(value, "min");
        return addCheck(new Check.Min<>(value, inclusive, message), SizedChecks.EXACT_SIZE);
    }

    public SetSchema<E> max(int value) {
        return max(value, null);
    }

    public SetSchema<E> max(int value, String message) {
        return max(value, true, message);
    }

    /** Upper bound on the element count; an exclusive bound rejects a count equal to {@code value}. */
    public SetSchema<E> max(int value, boolean inclusive, String message) {
        Check.requireSize(value, "max");
        return addCheck(new Check.Max<>(value, inclusive, message), SizedChecks.EXACT_SIZE);
    }

    public SetSchema<E> size(int value) {
        return size(value, null);
    }

    public SetSchema<E> size(int value, String message) {
        Check.requireSize(value, "size");
        return addCheck(new Check.Size(value, message), SizedChecks.SIZE_BOUNDS);
    }

    public SetSchema<E> nonempty() {
        return min(1);
    }

    public SetSchema<E> ascending(boolean convert) {
        return sort(Check.SortDirection.ASCENDING, convert, null);
    }

    public SetSchema<E> descending(boolean convert) {
        return sort(Check.SortDirection.DESCENDING, convert, null);
    }

    public SetSchema<E> sort(Check.SortDirection direction, boolean convert, String message) {
        return addCheck(new Check.Sort(direction, convert, message), SizedChecks.opposingSort(direction));
    }

    private SetSchema<E> addCheck(Check check, Set<String> cleared) {
        return new SetSchema<>(element, Check.add(checks, check, cleared), options());
    }

    @Override
    public TypeName typeName() {
        return TypeName.SET;
    }

    @Override
    public String hint() {
        return "Set<" + element.hint() + ">";
    }

    @Override
    CompletableFuture<ParseResult<Set<E>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.SET) {
            ctx.invalidType(ParsedType.SET);
            return ctx.abort();
        }
        List<Object> items = SizedChecks.apply(
                ctx, IssueKind.INVALID_SET, checks, new ArrayList<>((Collection<?>) ctx.data()));
        if (ctx.isInvalid() && ctx.abortEarly()) {
            return ctx.abort();
        }
        List<E> parsed = new ArrayList<>(Collections.nCopies(items.size(), null));
        return Steps.sequence(items.size(), i -> element.doParse(ctx.child(element, items.get(i), i))
                        .thenApply(result -> {
                            if (result.ok()) {
                                parsed.set(i, result.data());
                            }
                            return result.ok() || !ctx.abortEarly();
                        }))
                .thenCompose(done -> ctx.<Set<E>>result(new LinkedHashSet<>(parsed)));
    }

    @Override
    SetSchema<E> withOptions(SchemaOptions next) {
        return new SetSchema<>(element, checks, next);
    }
}

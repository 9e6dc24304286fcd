package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Steps;
import io.datashape.core.engine.Values;
import io.datashape.core.model.Check;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Validates every element of a list (or object array) against one element node, after the
 * declared checks. Elements are validated in order, one at a time.
 *
 * @param <E> element output type
 */
public final class ArraySchema<E> extends Schema<List<E>> {

    private final Schema<E> element;
    private final List<Check> checks;

    ArraySchema(Schema<E> element, List<Check> checks, SchemaOptions options) {
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

    /** The element node when it is itself an array node, otherwise this node. */
    public Schema<?> flatten() {
        return element instanceof ArraySchema<?> nested ? nested : this;
    }

    public ArraySchema<E> min(int value) {
        return min(value, null);
    }

    public ArraySchema<E> min(int value, String message) {
        return min(value, true, message);
    }

    /** Lower bound on the element count; an exclusive bound rejects a count equal to {@code value}. */
    public ArraySchema<E> min(int value, boolean inclusive, String message) {
        Check.requireSize(value, "min");
        return addCheck(new Check.Min<>(value, inclusive, message), SizedChecks.EXACT_SIZE);
    }

    public ArraySchema<E> max(int value) {
        return max(value, null);
    }

    public ArraySchema<E> max(int value, String message) {
        return max(value, true, message);
    }

    /** Upper bound on the element count; an exclusive bound rejects a count equal to {@code value}. */
    public ArraySchema<E> max(int value, boolean inclusive, String message) {
        Check.requireSize(value, "max");
        return addCheck(new Check.Max<>(value, inclusive, message), SizedChecks.EXACT_SIZE);
    }

    public ArraySchema<E> length(int value) {
        return length(value, null);
    }

    public ArraySchema<E> length(int value, String message) {
        Check.requireSize(value, "length");
        return addCheck(new Check.Length(value, message), SizedChecks.SIZE_BOUNDS);
    }

    /** At least one element. */
    public ArraySchema<E> nonempty() {
        return min(1);
    }

    /** Requires ascending order, or with {@code convert} sorts the output instead. */
    public ArraySchema<E> ascending(boolean convert) {
        return sort(Check.SortDirection.ASCENDING, convert, null);
    }

    public ArraySchema<E> descending(boolean convert) {
        return sort(Check.SortDirection.DESCENDING, convert, null);
    }

    public ArraySchema<E> sort(Check.SortDirection direction, boolean convert, String message) {
        return addCheck(new Check.Sort(direction, convert, message), SizedChecks.opposingSort(direction));
    }

    private ArraySchema<E> addCheck(Check check, Set<String> cleared) {
        return new ArraySchema<>(element, Check.add(checks, check, cleared), options());
    }

    @Override
    public TypeName typeName() {
        return TypeName.ARRAY;
    }

    @Override
    public String hint() {
        return "Array<" + element.hint() + ">";
    }

    @Override
    CompletableFuture<ParseResult<List<E>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.ARRAY) {
            ctx.invalidType(ParsedType.ARRAY);
            return ctx.abort();
        }
        List<Object> items = SizedChecks.apply(
                ctx, IssueKind.INVALID_ARRAY, checks, new ArrayList<>(Values.asList(ctx.data())));
        if (ctx.isInvalid() && ctx.abortEarly()) {
            return ctx.abort();
        }
        List<E> out = new ArrayList<>(Collections.nCopies(items.size(), null));
        return Steps.sequence(items.size(), i -> element.doParse(ctx.child(element, items.get(i), i))
                        .thenApply(result -> {
                            if (result.ok()) {
                                out.set(i, result.data());
                            }
                            return result.ok() || !ctx.abortEarly();
                        }))
                .thenCompose(done -> ctx.result(out));
    }

    @Override
    ArraySchema<E> withOptions(SchemaOptions next) {
        return new ArraySchema<>(element, checks, next);
    }
}

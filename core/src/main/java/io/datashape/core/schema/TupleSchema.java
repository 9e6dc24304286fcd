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
import java.util.concurrent.CompletableFuture;

/**
 * Fixed positional items plus an optional rest node for overflow positions. Too few items is a
 * {@code min} tuple issue; too many items without a rest node is a {@code max} tuple issue.
 */
public final class TupleSchema extends Schema<List<Object>> {

    private final List<Schema<?>> items;
    private final Schema<?> rest;

    TupleSchema(List<? extends Schema<?>> items, Schema<?> rest, SchemaOptions options) {
        super(options);
        this.items = List.copyOf(items);
        this.rest = rest;
    }

    public List<Schema<?>> items() {
        return items;
    }

    /** The rest node, or {@code null}. */
    public Schema<?> rest() {
        return rest;
    }

    /** Copy of this tuple accepting overflow items validated by {@code node}. */
    public TupleSchema rest(Schema<?> node) {
        return new TupleSchema(items, node, options());
    }

    @Override
    public TypeName typeName() {
        return TypeName.TUPLE;
    }

    @Override
    public String hint() {
        List<String> parts = new ArrayList<>();
        items.forEach(item -> parts.add(item.hint()));
        if (rest != null) {
            parts.add("..." + rest.hint() + "[]");
        }
        return "[" + String.join(", ", parts) + "]";
    }

    @Override
    CompletableFuture<ParseResult<List<Object>>> doParse(ParseContext ctx) {
        if (ctx.dataType() != ParsedType.ARRAY) {
            ctx.invalidType(ParsedType.ARRAY);
            return ctx.abort();
        }
        List<Object> values = new ArrayList<>(Values.asList(ctx.data()));
        if (values.size() < items.size()) {
            ctx.checkFailed(IssueKind.INVALID_TUPLE, new Check.Min<>(items.size(), true, null));
            return ctx.abort();
        }
        if (rest == null && values.size() > items.size()) {
            ctx.checkFailed(IssueKind.INVALID_TUPLE, new Check.Max<>(items.size(), true, null));
            return ctx.abort();
        }
        List<Object> out = new ArrayList<>(Collections.nCopies(values.size(), null));
        return Steps.sequence(values.size(), i -> {
                    Schema<?> node = i < items.size() ? items.get(i) : rest;
                    return node.doParse(ctx.child(node, values.get(i), i)).thenApply(result -> {
                        if (result.ok()) {
                            out.set(i, result.data());
                        }
                        return result.ok() || !ctx.abortEarly();
                    });
                })
                .thenCompose(done -> ctx.result(out));
    }

    @Override
    TupleSchema withOptions(SchemaOptions next) {
        return new TupleSchema(items, rest, next);
    }
}

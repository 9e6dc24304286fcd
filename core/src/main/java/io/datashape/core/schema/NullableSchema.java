package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts {@code null}, otherwise delegates.
 *
 * @param <O> inner output type
 */
public final class NullableSchema<O> extends Schema<O> {

    private final Schema<O> inner;

    NullableSchema(Schema<O> inner, SchemaOptions options) {
        super(options);
        this.inner = inner;
    }

    public Schema<O> unwrap() {
        return inner;
    }

    @Override
    public TypeName typeName() {
        return TypeName.NULLABLE;
    }

    @Override
    public String hint() {
        return inner.hint() + " | null";
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        if (ctx.rawData() == null) {
            return ctx.ok(null);
        }
        return inner.doParse(ctx.forNode(inner));
    }

    @Override
    NullableSchema<O> withOptions(SchemaOptions next) {
        return new NullableSchema<>(inner, next);
    }
}

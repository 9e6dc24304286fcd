package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Delegates and returns a fallback value instead of failing. The inner node runs in an isolated
 * context, so its issues never reach the enclosing parse.
 *
 * @param <O> output type
 */
public final class CatchSchema<O> extends Schema<O> {

    private final Schema<O> inner;
    private final Supplier<? extends O> fallback;

    CatchSchema(Schema<O> inner, Supplier<? extends O> fallback, SchemaOptions options) {
        super(options);
        this.inner = inner;
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    public Schema<O> unwrap() {
        return inner;
    }

    @Override
    public TypeName typeName() {
        return TypeName.CATCH;
    }

    @Override
    public String hint() {
        return inner.hint();
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        return inner.doParse(ctx.isolated(inner))
                .<ParseResult<O>>thenApply(result -> result.ok() ? result : ParseResult.success(fallback.get()));
    }

    @Override
    CatchSchema<O> withOptions(SchemaOptions next) {
        return new CatchSchema<>(inner, fallback, next);
    }
}

package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.ParseOptions;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Deferred-value node. The output is a future that validates the awaited payload against the inner
 * node, always asynchronously.
 *
 * <p>A synchronous parse requires the input to already be a {@link CompletionStage}; an
 * asynchronous parse wraps a plain value first.
 *
 * @param <O> payload output type
 */
public final class PromiseSchema<O> extends Schema<CompletableFuture<O>> {

    private final Schema<O> inner;

    PromiseSchema(Schema<O> inner, SchemaOptions options) {
        super(options);
        this.inner = inner;
    }

    public Schema<O> unwrap() {
        return inner;
    }

    @Override
    public TypeName typeName() {
        return TypeName.PROMISE;
    }

    @Override
    public String hint() {
        return "Promise<" + inner.hint() + ">";
    }

    @Override
    CompletableFuture<ParseResult<CompletableFuture<O>>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        if (!(data instanceof CompletionStage) && !ctx.isAsync()) {
            ctx.invalidType(ParsedType.PROMISE);
            return ctx.abort();
        }
        CompletionStage<?> stage =
                data instanceof CompletionStage<?> pending ? pending : CompletableFuture.completedFuture(data);
        ParseOptions options = ctx.common().toOptions(ctx.config());
        CompletableFuture<O> validated =
                stage.toCompletableFuture().thenCompose(payload -> inner.parseAsync(payload, options));
        return ctx.ok(validated);
    }

    @Override
    PromiseSchema<O> withOptions(SchemaOptions next) {
        return new PromiseSchema<>(inner, next);
    }
}

package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Substitutes a default for absent input, then delegates. The default goes through the inner node
 * like any other input.
 *
 * @param <O> output type
 */
public final class DefaultSchema<O> extends Schema<O> {

    private final Schema<O> inner;
    private final Supplier<? extends O> defaultValue;

    DefaultSchema(Schema<O> inner, Supplier<? extends O> defaultValue, SchemaOptions options) {
        super(options);
        this.inner = inner;
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must not be null");
    }

    public Schema<O> unwrap() {
        return inner;
    }

    /** A freshly generated default. */
    public O defaultValue() {
        return defaultValue.get();
    }

    @Override
    public TypeName typeName() {
        return TypeName.DEFAULT;
    }

    @Override
    public String hint() {
        return inner.hint();
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        if (ctx.rawData() == Undefined.INSTANCE) {
            ctx.setData(defaultValue.get());
        }
        return inner.doParse(ctx.forNode(inner));
    }

    @Override
    DefaultSchema<O> withOptions(SchemaOptions next) {
        return new DefaultSchema<>(inner, defaultValue, next);
    }
}

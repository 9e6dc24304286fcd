package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.model.Undefined;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts an absent value, otherwise delegates. Output is the inner output or
 * {@link Undefined#INSTANCE}, hence typed {@code Object}.
 *
 * @param <O> inner output type
 */
public final class OptionalSchema<O> extends Schema<Object> {

    private final Schema<O> inner;

    OptionalSchema(Schema<O> inner, SchemaOptions options) {
        super(options);
        this.inner = inner;
    }

    public Schema<O> unwrap() {
        return inner;
    }

    @Override
    public TypeName typeName() {
        return TypeName.OPTIONAL;
    }

    @Override
    public String hint() {
        return inner.hint() + " | undefined";
    }

    @Override
    CompletableFuture<ParseResult<Object>> doParse(ParseContext ctx) {
        if (ctx.rawData() == Undefined.INSTANCE) {
            return ctx.ok(Undefined.INSTANCE);
        }
        return widen(inner.doParse(ctx.forNode(inner)));
    }

    @Override
    OptionalSchema<O> withOptions(SchemaOptions next) {
        return new OptionalSchema<>(inner, next);
    }
}

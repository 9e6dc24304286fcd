package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.concurrent.CompletableFuture;

/**
 * Names a node for documentation purposes. Parsing is a pure passthrough.
 *
 * @param <O> output type
 */
public final class BrandedSchema<O> extends Schema<O> {

    private final Schema<O> inner;
    private final String brand;

    BrandedSchema(Schema<O> inner, String brand, SchemaOptions options) {
        super(options);
        this.inner = inner;
        this.brand = brand;
    }

    public Schema<O> unwrap() {
        return inner;
    }

    public String brand() {
        return brand;
    }

    @Override
    public TypeName typeName() {
        return TypeName.BRANDED;
    }

    @Override
    public String hint() {
        return inner.hint();
    }

    @Override
    CompletableFuture<ParseResult<O>> doParse(ParseContext ctx) {
        return inner.doParse(ctx.forNode(inner));
    }

    @Override
    BrandedSchema<O> withOptions(SchemaOptions next) {
        return new BrandedSchema<>(inner, brand, next);
    }
}

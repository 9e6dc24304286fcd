package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts instances of a class. The value is passed through uncopied.
 *
 * @param <T> the accepted class
 */
public final class InstanceOfSchema<T> extends Schema<T> {

    private final Class<T> type;

    InstanceOfSchema(Class<T> type, SchemaOptions options) {
        super(options);
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public TypeName typeName() {
        return TypeName.INSTANCE_OF;
    }

    @Override
    public String hint() {
        return type.getSimpleName();
    }

    @Override
    CompletableFuture<ParseResult<T>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        if (type.isInstance(data)) {
            return ctx.ok(type.cast(data));
        }
        ctx.report(IssueKind.INVALID_INSTANCE, new IssuePayload.InvalidInstance(type.getSimpleName()));
        return ctx.abort();
    }

    @Override
    InstanceOfSchema<T> withOptions(SchemaOptions next) {
        return new InstanceOfSchema<>(type, next);
    }
}

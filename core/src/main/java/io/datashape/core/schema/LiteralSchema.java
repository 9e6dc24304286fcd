package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Values;
import io.datashape.core.error.SchemaDefinitionException;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts exactly one primitive value. Numbers match by numeric value, so {@code literal(1)}
 * accepts {@code 1L}; the output is always the declared literal.
 *
 * @param <T> literal type
 */
public final class LiteralSchema<T> extends Schema<T> {

    private final T value;

    LiteralSchema(T value, SchemaOptions options) {
        super(options);
        if (!ParsedType.isPrimitive(value)) {
            throw new SchemaDefinitionException("Literal value must be a primitive; got " + ParsedType.of(value));
        }
        this.value = value;
    }

    public T value() {
        return value;
    }

    @Override
    public TypeName typeName() {
        return TypeName.LITERAL;
    }

    @Override
    public String hint() {
        return Values.literalize(value);
    }

    @Override
    CompletableFuture<ParseResult<T>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        if (!ParsedType.isPrimitive(data)) {
            ctx.invalidType(ParsedType.PRIMITIVE);
            return ctx.abort();
        }
        if (!Values.primitiveEquals(value, data)) {
            ctx.report(
                    IssueKind.INVALID_LITERAL,
                    new IssuePayload.InvalidLiteral(value, Values.literalize(value), data, Values.literalize(data)));
            return ctx.abort();
        }
        return ctx.ok(value);
    }

    @Override
    LiteralSchema<T> withOptions(SchemaOptions next) {
        return new LiteralSchema<>(value, next);
    }
}

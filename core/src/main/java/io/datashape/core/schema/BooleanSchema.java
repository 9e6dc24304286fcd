package io.datashape.core.schema;

import io.datashape.core.engine.ParseContext;
import io.datashape.core.engine.Values;
import io.datashape.core.model.ParseResult;
import io.datashape.core.model.ParsedType;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boolean node with three coercion policies: none (strict booleans only), blanket (any value cast
 * through truthiness) and selective (extra values listed as mapping to {@code true} or
 * {@code false}). Blanket and selective coercion exclude each other; enabling one clears the other.
 */
public final class BooleanSchema extends Schema<Boolean> {

    private final boolean coerce;
    private final List<Object> truthy;
    private final List<Object> falsy;

    BooleanSchema(boolean coerce, List<Object> truthy, List<Object> falsy, SchemaOptions options) {
        super(options);
        this.coerce = coerce;
        this.truthy = truthy;
        this.falsy = falsy;
    }

    /** Blanket coercion: every input becomes its truthiness. */
    public BooleanSchema coerce() {
        return new BooleanSchema(true, null, null, options());
    }

    /** Selective coercion: the given values also parse as {@code true}. */
    public BooleanSchema truthy(List<?> values) {
        return new BooleanSchema(false, List.copyOf(values), falsy, options());
    }

    /** Selective coercion: the given values also parse as {@code false}. */
    public BooleanSchema falsy(List<?> values) {
        return new BooleanSchema(false, truthy, List.copyOf(values), options());
    }

    public boolean isCoercing() {
        return coerce;
    }

    @Override
    public TypeName typeName() {
        return TypeName.BOOLEAN;
    }

    @Override
    public String hint() {
        return "boolean";
    }

    @Override
    CompletableFuture<ParseResult<Boolean>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        if (coerce) {
            return ctx.ok(Values.isTruthy(data));
        }
        if (contains(truthy, data)) {
            return ctx.ok(true);
        }
        if (contains(falsy, data)) {
            return ctx.ok(false);
        }
        if (data instanceof Boolean value) {
            return ctx.ok(value);
        }
        ctx.invalidType(ParsedType.BOOLEAN);
        return ctx.abort();
    }

    private static boolean contains(List<Object> values, Object data) {
        if (values == null) {
            return false;
        }
        for (Object value : values) {
            if (Values.primitiveEquals(value, data)) {
                return true;
            }
        }
        return false;
    }

    @Override
    BooleanSchema withOptions(SchemaOptions next) {
        return new BooleanSchema(coerce, truthy, falsy, next);
    }
}

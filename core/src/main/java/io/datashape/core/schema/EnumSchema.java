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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Accepts one of a fixed, ordered set of string or number values. Built from a value list or from
 * the constant names of a Java {@code enum}.
 */
public final class EnumSchema extends Schema<Object> {

    private final List<Object> values;

    EnumSchema(List<?> values, SchemaOptions options) {
        super(options);
        if (values.isEmpty()) {
            throw new SchemaDefinitionException("Enum must declare at least one value");
        }
        for (Object value : values) {
            if (!(value instanceof String) && !(value instanceof Number)) {
                throw new SchemaDefinitionException("Enum values must be strings or numbers; got " + value);
            }
        }
        this.values = List.copyOf(values);
    }

    static EnumSchema fromEnum(Class<? extends Enum<?>> type) {
        List<Object> names = new ArrayList<>();
        for (Enum<?> constant : type.getEnumConstants()) {
            names.add(constant.name());
        }
        return new EnumSchema(names, SchemaOptions.NONE);
    }

    public List<Object> values() {
        return values;
    }

    /** Each value mapped to itself, in declaration order. */
    public Map<Object, Object> enumMap() {
        Map<Object, Object> map = new LinkedHashMap<>();
        values.forEach(v -> map.put(v, v));
        return Collections.unmodifiableMap(map);
    }

    /** Enum restricted to the given values, which must all be members. */
    public EnumSchema extract(Object... keep) {
        List<Object> kept = new ArrayList<>();
        for (Object value : keep) {
            if (!contains(value)) {
                throw new SchemaDefinitionException(
                        "Cannot extract " + Values.literalize(value) + ": not an enum value");
            }
            kept.add(value);
        }
        return new EnumSchema(kept, options());
    }

    /** Enum without the given values. */
    public EnumSchema exclude(Object... drop) {
        List<Object> kept = new ArrayList<>(values);
        for (Object value : drop) {
            kept.removeIf(v -> Values.primitiveEquals(v, value));
        }
        return new EnumSchema(kept, options());
    }

    private boolean contains(Object data) {
        for (Object value : values) {
            if (Values.primitiveEquals(value, data)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public TypeName typeName() {
        return TypeName.ENUM;
    }

    @Override
    public String hint() {
        return Values.literalizeAll(values);
    }

    @Override
    CompletableFuture<ParseResult<Object>> doParse(ParseContext ctx) {
        Object data = ctx.rawData();
        ParsedType type = ctx.dataType();
        if (!acceptsType(type)) {
            ctx.invalidType(expectedType());
            return ctx.abort();
        }
        if (!contains(data)) {
            ctx.report(
                    IssueKind.INVALID_ENUM_VALUE,
                    new IssuePayload.InvalidEnumValue(values, hint(), data, Values.literalize(data)));
            return ctx.abort();
        }
        return ctx.ok(data);
    }

    private boolean acceptsType(ParsedType type) {
        ParsedType expected = expectedType();
        return expected == ParsedType.ENUM_VALUE
                ? type == ParsedType.STRING || type == ParsedType.NUMBER
                : type == expected;
    }

    private ParsedType expectedType() {
        boolean strings = values.stream().anyMatch(String.class::isInstance);
        boolean numbers = values.stream().anyMatch(Number.class::isInstance);
        if (strings && numbers) {
            return ParsedType.ENUM_VALUE;
        }
        return strings ? ParsedType.STRING : ParsedType.NUMBER;
    }

    @Override
    EnumSchema withOptions(SchemaOptions next) {
        return new EnumSchema(values, next);
    }
}

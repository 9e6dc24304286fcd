package io.datashape.core.model;

import io.datashape.core.spi.SchemaFunction;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Runtime classification of an input value. Used in {@code InvalidType} payloads and to decide
 * which reconciliation rule applies when merging intersection outputs.
 */
public enum ParsedType {
    ARRAY("Array"),
    BIGINT("bigint"),
    BOOLEAN("boolean"),
    BUFFER("Buffer"),
    DATE("Date"),
    ENUM_VALUE("string | number"),
    FALSE("false"),
    FUNCTION("function"),
    MAP("Map"),
    NAN("NaN"),
    NULL("null"),
    NUMBER("number"),
    OBJECT("object"),
    PRIMITIVE("string | number | bigint | boolean | symbol | null | undefined"),
    PROMISE("Promise"),
    REGEXP("RegExp"),
    SET("Set"),
    STRING("string"),
    SYMBOL("symbol"),
    TRUE("true"),
    UNDEFINED("undefined"),
    UNKNOWN("unknown"),
    VOID("void");

    private final String label;

    ParsedType(String label) {
        this.label = label;
    }

    /** Human-readable label used in messages, e.g. {@code "string"} or {@code "Array"}. */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * Classifies the given value. {@code java.util.Map} instances are keyed objects; lists and
     * object arrays are arrays.
     */
    public static ParsedType of(Object data) {
        if (data == Undefined.INSTANCE) {
            return UNDEFINED;
        }
        if (data == null) {
            return NULL;
        }
        if (data instanceof String) {
            return STRING;
        }
        if (data instanceof BigInteger) {
            return BIGINT;
        }
        if (data instanceof Double d && d.isNaN()) {
            return NAN;
        }
        if (data instanceof Float f && f.isNaN()) {
            return NAN;
        }
        if (data instanceof Number) {
            return NUMBER;
        }
        if (data instanceof Boolean) {
            return BOOLEAN;
        }
        if (data instanceof Symbol) {
            return SYMBOL;
        }
        if (data instanceof SchemaFunction || data instanceof Function) {
            return FUNCTION;
        }
        if (data instanceof List || data instanceof Object[]) {
            return ARRAY;
        }
        if (data instanceof byte[]) {
            return BUFFER;
        }
        if (data instanceof Instant || data instanceof Date) {
            return DATE;
        }
        if (data instanceof Set) {
            return SET;
        }
        if (data instanceof Map) {
            return OBJECT;
        }
        if (data instanceof CompletionStage) {
            return PROMISE;
        }
        if (data instanceof Pattern) {
            return REGEXP;
        }
        return UNKNOWN;
    }

    /** Returns {@code true} for values that are not containers, functions or deferred values. */
    public static boolean isPrimitive(Object data) {
        return switch (of(data)) {
            case STRING, NUMBER, NAN, BIGINT, BOOLEAN, SYMBOL, NULL, UNDEFINED -> true;
            default -> false;
        };
    }
}

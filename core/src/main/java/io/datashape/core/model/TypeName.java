package io.datashape.core.model;

/**
 * Closed set of schema node variants. Every node reports one of these tags; issue records carry
 * the tag of the node that produced them.
 */
public enum TypeName {
    ANY,
    ARRAY,
    BIGINT,
    BOOLEAN,
    BRANDED,
    CATCH,
    DATE,
    DEFAULT,
    EFFECTS,
    ENUM,
    FALSE,
    FUNCTION,
    INSTANCE_OF,
    INTERSECTION,
    LAZY,
    LITERAL,
    MAP,
    NAN,
    NEVER,
    NULL,
    NULLABLE,
    NUMBER,
    OBJECT,
    OPTIONAL,
    PROMISE,
    RECORD,
    SET,
    STRING,
    SYMBOL,
    TRUE,
    TUPLE,
    UNDEFINED,
    UNION,
    UNKNOWN,
    VOID
}

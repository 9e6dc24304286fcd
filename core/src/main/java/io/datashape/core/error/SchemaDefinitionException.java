package io.datashape.core.error;

/**
 * Thrown while a schema is being built, when its definition is itself invalid: a union with fewer
 * than two members, a negative length check, an empty enum and similar mistakes.
 */
public final class SchemaDefinitionException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message) {
        super(message, Phase.DEFINITION);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause, Phase.DEFINITION);
    }
}

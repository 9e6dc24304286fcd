package io.datashape.core.error;

/**
 * Abstract base for all datashape exceptions. Never thrown directly; concrete subclasses identify
 * whether the failure belongs to schema definition, parsing or configuration loading.
 */
public abstract class DataShapeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DEFINITION,
        PARSE,
        CONFIGURATION
    }

    private final Phase phase;

    protected DataShapeException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected DataShapeException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

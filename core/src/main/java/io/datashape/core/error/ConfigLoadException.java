package io.datashape.core.error;

/**
 * Thrown when a global configuration file cannot be read or contains invalid entries. Carries the
 * file or resource that caused the error.
 */
public final class ConfigLoadException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ConfigLoadException(String message, String source) {
        super(message, Phase.CONFIGURATION);
        this.source = source;
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.CONFIGURATION);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

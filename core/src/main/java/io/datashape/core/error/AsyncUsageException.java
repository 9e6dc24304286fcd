package io.datashape.core.error;

/**
 * Thrown by a synchronous parse when a refinement, transform or nested node produced a deferred
 * value. This is a programming error, not a validation failure, so it is never reported as an
 * issue.
 */
public final class AsyncUsageException extends DataShapeException {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_MESSAGE =
            "Synchronous parse encountered a deferred result; use parseAsync or safeParseAsync instead";

    public AsyncUsageException() {
        super(DEFAULT_MESSAGE, Phase.PARSE);
    }

    public AsyncUsageException(String message) {
        super(message, Phase.PARSE);
    }
}

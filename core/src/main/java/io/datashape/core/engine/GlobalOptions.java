package io.datashape.core.engine;

/** Process-wide parse defaults. */
public record GlobalOptions(boolean abortEarly, boolean debug) {

    public static final GlobalOptions DEFAULTS = new GlobalOptions(false, false);

    public GlobalOptions withAbortEarly(boolean value) {
        return new GlobalOptions(value, debug);
    }

    public GlobalOptions withDebug(boolean value) {
        return new GlobalOptions(abortEarly, value);
    }
}

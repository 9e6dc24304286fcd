package io.datashape.core.spi;

import java.util.Arrays;
import java.util.List;

/**
 * A callable value as seen by function schemas. Arguments arrive as a list; the return value may
 * be any data, including a {@link java.util.concurrent.CompletionStage}.
 *
 * <p>Plain {@link java.util.function.Function} values are also classified as functions and are
 * called with their single argument.
 */
@FunctionalInterface
public interface SchemaFunction {

    Object call(List<Object> args);

    /** Convenience for varargs call sites. */
    default Object invoke(Object... args) {
        return call(Arrays.asList(args));
    }
}

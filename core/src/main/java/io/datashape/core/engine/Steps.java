package io.datashape.core.engine;

import io.datashape.core.error.AsyncUsageException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Plumbing for the single parse path. Every node returns a {@link CompletableFuture}; in sync mode
 * that future is always already complete, and {@link #join} enforces it.
 */
public final class Steps {

    private static final CompletableFuture<Boolean> STOP = CompletableFuture.completedFuture(false);

    private Steps() {}

    /**
     * Returns the value of an already-completed step, rethrowing any exception it completed with.
     *
     * @throws AsyncUsageException if the step has not completed
     */
    public static <T> T join(CompletableFuture<T> step) {
        if (!step.isDone()) {
            throw new AsyncUsageException();
        }
        try {
            return step.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Turns a user-returned value into a step. Deferred values are awaited in async mode and
     * rejected in sync mode.
     *
     * @throws AsyncUsageException if {@code value} is deferred and the parse is synchronous
     */
    @SuppressWarnings("unchecked")
    public static <T> CompletableFuture<T> await(ParseContext ctx, Object value) {
        if (value instanceof CompletionStage<?> stage) {
            if (!ctx.isAsync()) {
                throw new AsyncUsageException();
            }
            return (CompletableFuture<T>) stage.toCompletableFuture();
        }
        return CompletableFuture.completedFuture((T) value);
    }

    /**
     * Runs {@code count} steps strictly one after another. Each step completes with {@code true} to
     * continue or {@code false} to skip the remaining ones.
     */
    public static CompletableFuture<Void> sequence(int count, IntFunction<CompletableFuture<Boolean>> step) {
        CompletableFuture<Boolean> chain = CompletableFuture.completedFuture(true);
        for (int i = 0; i < count; i++) {
            int index = i;
            chain = chain.thenCompose(proceed -> proceed ? step.apply(index) : STOP);
        }
        return chain.thenApply(ignored -> null);
    }

    /** Runs {@code body}, converting a synchronous throw into a failed future. */
    public static <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Strips {@link CompletionException} layers, returning the original runtime failure. */
    public static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }
}

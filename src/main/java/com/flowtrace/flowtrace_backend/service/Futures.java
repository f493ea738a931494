package com.flowtrace.flowtrace_backend.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/** Small helpers around CompletableFuture so callers see the original exception, not the wrapper. */
final class Futures {

    private Futures() {}

    /** Like supplyAsync, but a saturated executor yields a failed future instead of throwing at the call site. */
    static <T> CompletableFuture<T> supplyAsync(Supplier<T> supplier, Executor executor) {
        try {
            return CompletableFuture.supplyAsync(supplier, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static RuntimeException propagate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error fatal) {
            throw fatal;
        }
        if (cause instanceof TimeoutException) {
            return new IllegalStateException("Timed out waiting for the entity store", cause);
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw propagate(e);
        }
    }
}

package com.streamity.telemetry.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Process-wide hook for asynchronous failures nobody else handles.
 * <p>
 * Code that fires off a {@link CompletableFuture} without consuming its outcome passes it
 * to {@link #track(CompletableFuture)}; if it completes exceptionally the failure goes to the
 * installed listener. Cancellation is not treated as a failure.
 */
@Slf4j
public final class UnhandledRejections {

    private static volatile Consumer<Throwable> listener;

    private UnhandledRejections() {
    }

    public static <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        future.whenComplete((value, failure) -> {
            if (failure != null) {
                dispatch(unwrap(failure));
            }
        });
        return future;
    }

    static void setListener(Consumer<Throwable> newListener) {
        listener = newListener;
    }

    static void clearListener() {
        listener = null;
    }

    static boolean hasListener() {
        return listener != null;
    }

    private static void dispatch(Throwable failure) {
        if (failure instanceof CancellationException) {
            return;
        }
        Consumer<Throwable> current = listener;
        if (current == null) {
            log.debug("Unhandled async failure with no listener installed", failure);
            return;
        }
        try {
            current.accept(failure);
        } catch (RuntimeException e) {
            log.debug("Unhandled rejection listener failed", e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}

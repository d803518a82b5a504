package com.bubblegrade.service.pipeline;

import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.exception.PersistenceException;
import com.bubblegrade.exception.ScanProcessingException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of one pipeline step: either a value or the failure that stopped the scan. Storage
 * failures are not captured and propagate to the caller.
 */
final class StepResult<T> {

    private final T value;
    private final ScanProcessingException failure;

    private StepResult(T value, ScanProcessingException failure) {
        this.value = value;
        this.failure = failure;
    }

    static <T> StepResult<T> attempt(String step, Supplier<T> action) {
        try {
            return new StepResult<>(Objects.requireNonNull(action.get(), step + " produced no result"), null);
        } catch (RuntimeException ex) {
            return new StepResult<>(null, captured(step, ex));
        }
    }

    /**
     * Runs the next step on this value, or carries this failure forward without running it.
     */
    <R> StepResult<R> then(String step, Function<? super T, ? extends R> next) {
        if (failed()) {
            return new StepResult<>(null, failure);
        }
        return attempt(step, () -> next.apply(value));
    }

    boolean failed() {
        return failure != null;
    }

    T value() {
        if (failed()) {
            throw new IllegalStateException("Step failed", failure);
        }
        return value;
    }

    ScanProcessingException failure() {
        return failure;
    }

    private static ScanProcessingException captured(String step, RuntimeException ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof PersistenceException persistence) {
            throw persistence;
        }
        if (cause instanceof ScanProcessingException processing) {
            return processing;
        }
        return new ExtractionException(step + " failed: " + cause.getMessage(), cause);
    }
}

package com.docforge.core.pipeline;

import java.util.Objects;

/**
 * Explicit outcome of one adapter call made at a unit boundary.
 *
 * @param value returned value, null unless successful
 * @param failure failure kind, null when successful
 * @param message failure description, null when successful
 * @param <T> value type
 */
public record CallResult<T>(T value, Failure failure, String message) {

    /**
     * Why a call produced no value.
     */
    public enum Failure {
        /** The per-call timeout or the build deadline elapsed. */
        TIMEOUT,
        /** The adapter threw. */
        FAILED
    }

    public static <T> CallResult<T> ok(T value) {
        return new CallResult<>(value, null, null);
    }

    public static <T> CallResult<T> timeout(String message) {
        return new CallResult<>(null, Failure.TIMEOUT, Objects.requireNonNull(message));
    }

    public static <T> CallResult<T> failed(String message) {
        return new CallResult<>(null, Failure.FAILED, Objects.requireNonNull(message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }
}

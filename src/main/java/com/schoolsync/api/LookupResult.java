package com.schoolsync.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a remote call. Retry decisions are made on {@link Status}, never
 * by catching exception types at the call site.
 */
public final class LookupResult<T> {

    public enum Status {
        FOUND,
        NOT_FOUND,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    private final Status status;
    private final T value;
    private final String reason;
    private final Duration retryAfter;

    private LookupResult(Status status, T value, String reason, Duration retryAfter) {
        this.status = status;
        this.value = value;
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public static <T> LookupResult<T> found(T value) {
        return new LookupResult<>(Status.FOUND, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> LookupResult<T> notFound(String reason) {
        return new LookupResult<>(Status.NOT_FOUND, null, reason, null);
    }

    public static <T> LookupResult<T> transientFailure(String reason) {
        return new LookupResult<>(Status.TRANSIENT_FAILURE, null, reason, null);
    }

    public static <T> LookupResult<T> transientFailure(String reason, Duration retryAfter) {
        return new LookupResult<>(Status.TRANSIENT_FAILURE, null, reason, retryAfter);
    }

    public static <T> LookupResult<T> permanentFailure(String reason) {
        return new LookupResult<>(Status.PERMANENT_FAILURE, null, reason, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isTransient() {
        return status == Status.TRANSIENT_FAILURE;
    }

    public T getValue() {
        if (status != Status.FOUND) {
            throw new IllegalStateException("No value for result with status " + status);
        }
        return value;
    }

    public T orElse(T fallback) {
        return status == Status.FOUND ? value : fallback;
    }

    public String getReason() {
        return reason;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String toString() {
        return status == Status.FOUND ? "FOUND(" + value + ")" : status + "(" + reason + ")";
    }
}

package org.javai.deployguard;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A classified failure, ready for retry decisions and reporting.
 *
 * @param code The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type The failure type, which drives retry decisions
 * @param exception The exception the operation threw (may be null)
 * @param retryAfter Delay the remote side asked for before the next attempt (may be null)
 * @param operation The operation that failed (e.g., "WorkspaceApi.create")
 * @param occurredAt When the failure happened
 */
public record Failure(
        FailureCode code,
        String message,
        FailureType type,
        Throwable exception,
        Duration retryAfter,
        String operation,
        Instant occurredAt
) {

    public Failure {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
    }

    // === Factory methods for common failure types ===

    /**
     * Creates a transient failure that may resolve on retry.
     */
    public static Failure transientFailure(FailureCode code, String message, String operation, Throwable exception) {
        return new Failure(code, message, FailureType.TRANSIENT, exception, null, operation, Instant.now());
    }

    /**
     * Creates a transient failure with a retry delay hint.
     */
    public static Failure transientFailure(FailureCode code, String message, String operation,
                                           Throwable exception, Duration retryAfter) {
        return new Failure(code, message, FailureType.TRANSIENT, exception, retryAfter, operation, Instant.now());
    }

    /**
     * Creates a permanent failure that will not resolve on retry.
     */
    public static Failure permanentFailure(FailureCode code, String message, String operation, Throwable exception) {
        return new Failure(code, message, FailureType.PERMANENT, exception, null, operation, Instant.now());
    }

    /**
     * Creates a failure for an attempt that was abandoned because the caller was cancelled.
     */
    public static Failure cancelled(String message, String operation, Throwable exception) {
        return new Failure(FailureCode.of("execution", "cancelled"), message, FailureType.CANCELLED,
                exception, null, operation, Instant.now());
    }

    public boolean isRetryable() {
        return type == FailureType.TRANSIENT;
    }
}

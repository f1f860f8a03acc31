package org.javai.deployguard;

/**
 * Classifies failures by how the engine must react to them.
 */
public enum FailureType {
    /**
     * Temporary failure that may resolve on retry.
     * Examples: network timeout, connection refused, rate limited, 5xx response.
     */
    TRANSIENT,

    /**
     * Permanent failure that will not resolve on retry.
     * Examples: validation failure, resource not found, unauthorized.
     */
    PERMANENT,

    /**
     * The call was never attempted because a circuit breaker is protecting the dependency.
     * Try again later; this says nothing about whether the operation itself is valid.
     */
    CIRCUIT_OPEN,

    /**
     * The caller was cancelled (thread interrupted) before or between attempts.
     * Never retried.
     */
    CANCELLED
}

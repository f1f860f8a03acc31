package org.javai.deployguard.ops;

import java.time.Duration;
import org.javai.deployguard.Failure;
import org.javai.deployguard.breaker.CircuitBreakerListener;
import org.javai.deployguard.breaker.CircuitBreakerTransition;

/**
 * Reports failures and resilience events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>The engine's retry loop and circuit breakers do no logging of their own; they hand
 * events to a reporter, and the reporter decides what reaches the operator.</p>
 */
public interface OpReporter {

    /**
     * Reports a failure that will not be retried.
     */
    void report(Failure failure);

    /**
     * Reports a retry attempt.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The backoff before the next attempt
     * @param policyId The retry policy being applied
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retry attempts have been exhausted on a retryable failure.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param policyId The retry policy that was exhausted
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state change.
     */
    default void reportCircuitTransition(CircuitBreakerTransition transition) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Adapts this reporter to receive circuit breaker transitions.
     */
    default CircuitBreakerListener asCircuitBreakerListener() {
        return this::reportCircuitTransition;
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}

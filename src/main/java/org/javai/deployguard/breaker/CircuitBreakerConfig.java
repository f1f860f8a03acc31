package org.javai.deployguard.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for a {@link CircuitBreaker}.
 *
 * @param failureThreshold consecutive failures that open a closed circuit
 * @param cooldown time an open circuit waits before admitting probes
 * @param successThreshold consecutive probe successes that close a half-open circuit
 * @param halfOpenMaxConcurrent probes allowed in flight at once while half-open
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration cooldown,
        int successThreshold,
        int halfOpenMaxConcurrent
) {

    public CircuitBreakerConfig {
        Objects.requireNonNull(cooldown, "cooldown must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, was: " + successThreshold);
        }
        if (halfOpenMaxConcurrent < 1) {
            throw new IllegalArgumentException("halfOpenMaxConcurrent must be >= 1, was: " + halfOpenMaxConcurrent);
        }
    }

    /**
     * Five failures to open, 60s cooldown, two successes to close, three concurrent probes.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 2, 3);
    }
}

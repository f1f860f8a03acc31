package org.javai.deployguard.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * A read-only view of a circuit breaker at one instant.
 *
 * @param name the dependency name
 * @param state the current state
 * @param consecutiveFailures failures counted while closed
 * @param consecutiveSuccesses probe successes counted while half-open
 * @param halfOpenInFlight probes currently running
 * @param openedAt when the circuit last opened, or null if closed
 * @param remainingCooldown time until probes are admitted; zero unless open
 * @param config the breaker's thresholds
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitBreakerState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        int halfOpenInFlight,
        Instant openedAt,
        Duration remainingCooldown,
        CircuitBreakerConfig config
) {
}

package org.javai.deployguard.breaker;

import java.time.Instant;
import java.util.Objects;

/**
 * A state change of a named circuit breaker.
 *
 * @param breakerName the dependency name
 * @param from the state before
 * @param to the state after
 * @param at when the change happened
 */
public record CircuitBreakerTransition(
        String breakerName,
        CircuitBreakerState from,
        CircuitBreakerState to,
        Instant at
) {

    public CircuitBreakerTransition {
        Objects.requireNonNull(breakerName, "breakerName must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}

package org.javai.deployguard.breaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitBreakerState {
    /**
     * Normal operation. Calls pass through; consecutive failures are counted.
     */
    CLOSED,

    /**
     * Too many consecutive failures. Calls fail fast until the cooldown elapses.
     */
    OPEN,

    /**
     * Cooldown elapsed. A limited number of probe calls test whether the dependency recovered.
     */
    HALF_OPEN
}

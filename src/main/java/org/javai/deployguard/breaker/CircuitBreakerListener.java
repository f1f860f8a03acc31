package org.javai.deployguard.breaker;

/**
 * Receives circuit breaker state changes, for health checks and operator reporting.
 * Invoked on the calling thread after the breaker's lock is released.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onTransition(CircuitBreakerTransition transition);

    static CircuitBreakerListener noOp() {
        return transition -> {};
    }
}

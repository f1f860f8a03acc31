package org.javai.deployguard.retry;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptNumber The attempt that just completed (1-based)
 */
public record RetryContext(int attemptNumber) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
    }

    public static RetryContext first() {
        return new RetryContext(1);
    }

    public RetryContext next() {
        return new RetryContext(attemptNumber + 1);
    }
}

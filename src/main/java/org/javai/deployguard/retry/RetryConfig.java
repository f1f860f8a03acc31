package org.javai.deployguard.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for exponential backoff with jitter.
 *
 * @param maxAttempts total attempts including the first (at least 1)
 * @param initialDelay delay before the second attempt, before jitter
 * @param maxDelay cap on the computed delay, before jitter
 * @param backoffFactor growth factor between consecutive delays (greater than 1)
 * @param jitterFraction relative spread applied to each delay, between 0 and 1
 */
public record RetryConfig(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double backoffFactor,
        double jitterFraction
) {

    public RetryConfig {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (!(backoffFactor > 1.0)) {
            throw new IllegalArgumentException("backoffFactor must be > 1, was: " + backoffFactor);
        }
        if (!(jitterFraction >= 0.0 && jitterFraction <= 1.0)) {
            throw new IllegalArgumentException("jitterFraction must be within [0, 1], was: " + jitterFraction);
        }
    }

    /**
     * Three attempts, 1s initial delay doubling up to 60s, 10% jitter.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, 0.1);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffFactor, jitterFraction);
    }

    public RetryConfig withoutJitter() {
        return new RetryConfig(maxAttempts, initialDelay, maxDelay, backoffFactor, 0.0);
    }

    /**
     * The delay after the given failed attempt, ignoring jitter:
     * {@code min(maxDelay, initialDelay * backoffFactor^(attemptNumber - 1))}.
     *
     * @param attemptNumber the attempt that just failed (1-based)
     */
    public Duration backoffDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, attemptNumber - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Spreads a delay by up to {@code jitterFraction} in either direction.
     *
     * @param delay the un-jittered delay
     * @param random a uniform sample in [0, 1)
     */
    public Duration applyJitter(Duration delay, double random) {
        if (jitterFraction == 0.0) {
            return delay;
        }
        double factor = 1.0 + jitterFraction * (2.0 * random - 1.0);
        long millis = Math.round(delay.toMillis() * factor);
        return Duration.ofMillis(Math.max(0L, millis));
    }
}

package org.javai.deployguard.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} wants done with a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Sleep for {@code delay}, then make another attempt.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop here. The failed attempt becomes the final outcome and {@code reason} is reported.
     */
    record GiveUp(String reason) implements RetryDecision {
        public static GiveUp because(String reason) {
            return new GiveUp(reason);
        }
    }
}

package org.javai.deployguard.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;
import org.javai.deployguard.Failure;
import org.javai.deployguard.FailureType;

/**
 * Decides whether and when to retry after a failure.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, Failure failure);

    /**
     * This policy while {@code enabled} answers true, and a policy that never retries otherwise.
     * The condition is checked on every decision, so a switch flipped at runtime takes effect
     * on the next failure.
     */
    default RetryPolicy onlyWhen(BooleanSupplier enabled) {
        Objects.requireNonNull(enabled, "enabled must not be null");
        RetryPolicy delegate = this;
        return new RetryPolicy() {
            @Override
            public String id() {
                return delegate.id();
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                if (!enabled.getAsBoolean()) {
                    return RetryDecision.GiveUp.because("retry disabled");
                }
                return delegate.decide(context, failure);
            }
        };
    }

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a simple policy with fixed delay and max attempts.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(delay);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                RetryDecision.GiveUp giveUp = giveUpReason(context, failure, maxAttempts);
                if (giveUp != null) {
                    return giveUp;
                }
                return RetryDecision.Retry.after(failure.retryAfter() != null ? failure.retryAfter() : delay);
            }
        };
    }

    /**
     * Creates a policy with exponential backoff and jitter drawn from {@link ThreadLocalRandom}.
     */
    static RetryPolicy exponentialBackoff(String id, RetryConfig config) {
        return exponentialBackoff(id, config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a policy with exponential backoff and jitter drawn from the given source.
     *
     * <p>The delay after attempt {@code n} is {@link RetryConfig#backoffDelay(int)} spread by
     * {@link RetryConfig#applyJitter(Duration, double)}. A failure carrying a retry-after hint
     * replaces that delay for the one attempt it was observed on.
     *
     * @param id policy identifier for reporting
     * @param config backoff tunables
     * @param random uniform samples in [0, 1)
     */
    static RetryPolicy exponentialBackoff(String id, RetryConfig config, DoubleSupplier random) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(config);
        Objects.requireNonNull(random);

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                RetryDecision.GiveUp giveUp = giveUpReason(context, failure, config.maxAttempts());
                if (giveUp != null) {
                    return giveUp;
                }

                // Respect the remote side's retry-after hint for this attempt only
                if (failure.retryAfter() != null) {
                    return RetryDecision.Retry.after(failure.retryAfter());
                }

                Duration delay = config.backoffDelay(context.attemptNumber());
                return RetryDecision.Retry.after(config.applyJitter(delay, random.getAsDouble()));
            }
        };
    }

    private static RetryDecision.GiveUp giveUpReason(RetryContext context, Failure failure, int maxAttempts) {
        if (failure.type() == FailureType.CANCELLED) {
            return RetryDecision.GiveUp.because("cancelled");
        }
        if (failure.type() == FailureType.CIRCUIT_OPEN) {
            return RetryDecision.GiveUp.because("circuit open");
        }
        if (failure.type() != FailureType.TRANSIENT) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (context.attemptNumber() >= maxAttempts) {
            return RetryDecision.GiveUp.because("max attempts reached");
        }
        return null;
    }
}

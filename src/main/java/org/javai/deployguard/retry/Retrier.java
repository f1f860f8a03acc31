package org.javai.deployguard.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.javai.deployguard.Failure;
import org.javai.deployguard.Outcome;
import org.javai.deployguard.boundary.Boundary;
import org.javai.deployguard.boundary.RetryClassifier;
import org.javai.deployguard.boundary.ThrowingSupplier;
import org.javai.deployguard.ops.OpReporter;

/**
 * Executes operations with retry logic based on policies.
 * Operates entirely over Outcome values: no exception thrown by the operation escapes,
 * and the final failure carries the operation's own exception unchanged.
 *
 * <p>The retrier performs no I/O of its own beyond sleeping the calling thread between
 * attempts. Retry events go to the configured {@link OpReporter}, which defaults to a no-op.</p>
 *
 * <p>Cancellation is cooperative: the calling thread's interrupt flag is checked before every
 * attempt, and an interrupt during a backoff sleep ends the call. Either way the result is a
 * {@link org.javai.deployguard.FailureType#CANCELLED} failure, never a retry.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.exponentialBackoff("provisioning", RetryConfig.defaults()))
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * RetryResult<Workspace> result = retrier.execute(
 *     "WorkspaceApi.create",
 *     () -> api.createWorkspace(request),
 *     RetryClassifier.anyOf(SocketTimeoutException.class, ThrottledException.class)
 * );
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    private Retrier(RetryPolicy policy, OpReporter reporter, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = Thread::sleep;

        private Builder() {}

        /**
         * Sets the retry policy (required).
         *
         * @param policy the retry policy to use
         * @return this builder
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Replaces {@link Thread#sleep(long)} (optional). Tests use this to avoid real waiting.
         *
         * @param sleeper the sleeper to use between attempts
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, reporter, sleeper);
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Executes an operation that may throw, classifying each exception with the given classifier.
     *
     * @param operation The operation name for reporting
     * @param work The work to execute on every attempt
     * @param isRetryable Decides which exceptions are worth another attempt
     * @return The final outcome and every attempt made
     */
    public <T> RetryResult<T> execute(
            String operation,
            ThrowingSupplier<T, ? extends Exception> work,
            RetryClassifier isRetryable
    ) {
        Objects.requireNonNull(work, "work must not be null");
        Boundary boundary = Boundary.of(isRetryable);
        return execute(operation, () -> boundary.call(operation, work));
    }

    /**
     * Executes an operation that already reports its result as an Outcome.
     *
     * @param operation The operation name for reporting
     * @param attempt A supplier that returns an Outcome
     * @return The final outcome and every attempt made
     */
    public <T> RetryResult<T> execute(String operation, Supplier<Outcome<T>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        List<RetryAttempt> attempts = new ArrayList<>();
        RetryContext context = RetryContext.first();

        while (true) {
            int attemptNumber = context.attemptNumber();
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(operation, attempts, new CancellationException(
                        "Cancelled before attempt " + attemptNumber + " of [" + operation + "]"));
            }

            Outcome<T> result = attempt.get();
            Failure failure = Outcome.failureOf(result);
            if (failure == null) {
                attempts.add(new RetryAttempt(attemptNumber, null, null));
                return new RetryResult<>(result, attempts);
            }

            RetryDecision decision = policy.decide(context, failure);
            if (decision instanceof RetryDecision.Retry retry) {
                attempts.add(new RetryAttempt(attemptNumber, failure, retry.delay()));
                reporter.reportRetryAttempt(failure, attemptNumber, retry.delay(), policy.id());
                try {
                    sleep(retry.delay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return cancelled(operation, attempts, e);
                }
                context = context.next();
                continue;
            }

            attempts.add(new RetryAttempt(attemptNumber, failure, null));
            if (failure.isRetryable()) {
                reporter.reportRetryExhausted(failure, attemptNumber, policy.id());
            } else {
                reporter.report(failure);
            }
            return new RetryResult<>(result, attempts);
        }
    }

    private <T> RetryResult<T> cancelled(String operation, List<RetryAttempt> attempts, Exception cause) {
        Failure failure = Failure.cancelled(
                "Retry of [" + operation + "] cancelled after " + attempts.size() + " attempt(s)",
                operation,
                cause);
        reporter.report(failure);
        return new RetryResult<>(Outcome.fail(failure), attempts);
    }

    private void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        sleeper.sleep(duration.toMillis());
    }

    // === STATIC CONVENIENCE ===

    /**
     * Runs an operation with exponential backoff using the given configuration and no reporting.
     *
     * @param work the work to execute
     * @param isRetryable decides which exceptions are worth another attempt
     * @param config backoff tunables
     * @return the final outcome and every attempt made
     */
    public static <T> RetryResult<T> attempt(
            ThrowingSupplier<T, ? extends Exception> work,
            RetryClassifier isRetryable,
            RetryConfig config
    ) {
        Retrier retrier = Retrier.builder()
                .policy(RetryPolicy.exponentialBackoff("attempt", config))
                .build();
        return retrier.execute("attempt", work, isRetryable);
    }

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}

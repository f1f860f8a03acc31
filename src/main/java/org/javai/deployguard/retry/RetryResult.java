package org.javai.deployguard.retry;

import java.util.List;
import java.util.Objects;
import org.javai.deployguard.Failure;
import org.javai.deployguard.Outcome;

/**
 * The final outcome of a {@link Retrier} call together with every attempt made.
 *
 * @param outcome the last attempt's outcome, unchanged
 * @param attempts attempts in execution order; empty if the caller was cancelled before the first
 * @param <T> the type of the successful value
 */
public record RetryResult<T>(Outcome<T> outcome, List<RetryAttempt> attempts) {

    public RetryResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        attempts = List.copyOf(attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    public boolean isOk() {
        return outcome.isOk();
    }

    public boolean isFail() {
        return outcome.isFail();
    }

    /**
     * @return the final failure, or null if the call succeeded
     */
    public Failure failure() {
        return Outcome.failureOf(outcome);
    }

    public T getOrThrow() {
        return outcome.getOrThrow();
    }

    /**
     * Returns the value or throws the last attempt's original exception.
     */
    public T getOrRethrow() throws Exception {
        return outcome.getOrRethrow();
    }
}

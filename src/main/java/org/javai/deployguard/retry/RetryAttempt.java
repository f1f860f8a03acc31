package org.javai.deployguard.retry;

import java.time.Duration;
import org.javai.deployguard.Failure;

/**
 * One execution try within a single {@link Retrier} call.
 *
 * @param attemptNumber 1-based attempt number
 * @param failure the failure this attempt ended with, or null if it succeeded
 * @param delayBeforeNext the backoff chosen before the next attempt, or null if none followed
 */
public record RetryAttempt(int attemptNumber, Failure failure, Duration delayBeforeNext) {

    public boolean succeeded() {
        return failure == null;
    }
}

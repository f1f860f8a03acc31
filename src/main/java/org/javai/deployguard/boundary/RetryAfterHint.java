package org.javai.deployguard.boundary;

import java.time.Duration;

/**
 * Implemented by exceptions that carry an explicit "retry after" instruction from the
 * remote side, typically the {@code Retry-After} header of a 429 response.
 *
 * <p>When present, the hint replaces the computed backoff delay for the next attempt only.
 */
public interface RetryAfterHint {

    /**
     * @return the delay requested by the remote side, or null if it gave none
     */
    Duration retryAfter();
}

package org.javai.deployguard.transaction;

import java.util.Objects;

/**
 * A cleanup that threw during rollback. The resource may still exist.
 *
 * @param resource the resource whose cleanup failed
 * @param exception what the cleanup threw
 */
public record CleanupFailure(TrackedResource resource, Exception exception) {

    public CleanupFailure {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(exception, "exception must not be null");
    }

    public String message() {
        String message = exception.getMessage();
        return message != null ? message : exception.getClass().getSimpleName();
    }
}

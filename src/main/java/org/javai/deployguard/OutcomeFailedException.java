package org.javai.deployguard;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first or used pattern matching.
 * The original exception, if any, is the cause.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed [" + failure.code() + "]: " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}

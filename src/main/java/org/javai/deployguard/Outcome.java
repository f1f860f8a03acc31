package org.javai.deployguard;

import java.util.Objects;

/**
 * The result of a deployment step that can fail.
 * An {@link Ok} holds the produced value; a {@link Fail} holds the {@link Failure} that stopped it.
 *
 * <p>Retry, circuit breaking and secret lookup all report their results as Outcome values,
 * so callers branch on data rather than on caught exceptions. The exception that caused a
 * failure is never replaced: {@link Failure#exception()} is the one the operation threw.
 *
 * @param <T> type of the value produced on success
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * The step produced its value.
     *
     * @param value the successful value (may be null for {@code Outcome<Void>})
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrRethrow() {
            return value;
        }
    }

    /**
     * The step failed.
     *
     * @param failure what went wrong, never null
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrRethrow() throws Exception {
            Throwable cause = failure.exception();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new OutcomeFailedException(failure);
        }
    }

    // State
    boolean isOk();
    boolean isFail();

    // Extraction
    T getOrThrow();

    /**
     * Returns the value, or throws the exception that caused the failure exactly as the
     * operation threw it. Failures without an underlying exception (for example a missing
     * secret) are thrown as {@link OutcomeFailedException}.
     */
    T getOrRethrow() throws Exception;

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    /**
     * Returns the failure of a failed outcome, or null for a successful one.
     */
    static Failure failureOf(Outcome<?> outcome) {
        return outcome instanceof Fail<?> fail ? fail.failure() : null;
    }
}

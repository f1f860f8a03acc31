package org.javai.deployguard.boundary;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether an error thrown by an operation is worth another attempt.
 *
 * <p>Supplied per call site: only the caller knows the wrapped API's error taxonomy,
 * so the engine ships no provider-specific classification. Timeouts, 5xx responses and
 * rate limits are typically retryable; validation errors and other 4xx responses are not.
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * @param error the exception thrown by the operation
     * @return true if another attempt may succeed
     */
    boolean isRetryable(Throwable error);

    /**
     * Combines two classifiers; an error is retryable if either says so.
     */
    default RetryClassifier or(RetryClassifier other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> isRetryable(error) || other.isRetryable(error);
    }

    /**
     * Treats every error as retryable.
     */
    static RetryClassifier always() {
        return error -> true;
    }

    /**
     * Treats no error as retryable.
     */
    static RetryClassifier never() {
        return error -> false;
    }

    /**
     * Treats an error as retryable when it is an instance of any of the given types.
     *
     * @param types the retryable exception types
     * @return a classifier matching those types
     */
    @SafeVarargs
    static RetryClassifier anyOf(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> retryable = List.of(types);
        return error -> retryable.stream().anyMatch(type -> type.isInstance(error));
    }
}

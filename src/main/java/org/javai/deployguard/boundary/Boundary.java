package org.javai.deployguard.boundary;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.javai.deployguard.Failure;
import org.javai.deployguard.FailureCode;
import org.javai.deployguard.FailureType;
import org.javai.deployguard.Outcome;
import org.javai.deployguard.breaker.CircuitOpenException;

/**
 * Translates exceptions thrown by an operation into {@link Outcome} values.
 *
 * <p>This is the single point where exceptions become failures. After passing through a
 * Boundary, the retry loop operates entirely in outcome-space and decides what to do by
 * inspecting {@link Failure#type()} rather than by catching exception types.</p>
 *
 * <p>Classification order:</p>
 * <ol>
 *   <li>{@link InterruptedException} and {@link CancellationException} become
 *       {@link FailureType#CANCELLED}; the interrupt flag is restored.</li>
 *   <li>{@link CircuitOpenException} becomes {@link FailureType#CIRCUIT_OPEN}.</li>
 *   <li>Anything the {@link RetryClassifier} accepts becomes {@link FailureType#TRANSIENT},
 *       carrying the {@link RetryAfterHint} if the exception has one.</li>
 *   <li>Everything else becomes {@link FailureType#PERMANENT}.</li>
 * </ol>
 *
 * <p>{@link Error}s are not caught.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.of(RetryClassifier.anyOf(SocketTimeoutException.class));
 * Outcome<Workspace> result = boundary.call("WorkspaceApi.create", () -> api.create(request));
 * }</pre>
 */
public final class Boundary {

    private final RetryClassifier classifier;
    private final Clock clock;

    public static Boundary of(RetryClassifier classifier) {
        return new Boundary(classifier, Clock.systemUTC());
    }

    public Boundary(RetryClassifier classifier, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Executes work that may throw, translating any exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (Exception e) {
            return Outcome.fail(classify(operation, e));
        }
    }

    /**
     * Classifies an exception thrown by the named operation.
     */
    public Failure classify(String operation, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();

        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return failure(FailureCode.of("execution", "cancelled"), message, FailureType.CANCELLED, e, operation);
        }
        if (e instanceof CancellationException) {
            return failure(FailureCode.of("execution", "cancelled"), message, FailureType.CANCELLED, e, operation);
        }
        if (e instanceof CircuitOpenException open) {
            return failure(FailureCode.of("circuit", open.reason().code()), message,
                    FailureType.CIRCUIT_OPEN, e, operation);
        }
        if (classifier.isRetryable(e)) {
            return new Failure(
                    FailureCode.of("transient", e.getClass().getSimpleName()),
                    message,
                    FailureType.TRANSIENT,
                    e,
                    retryAfterOf(e),
                    operation,
                    clock.instant());
        }
        return failure(FailureCode.of("permanent", e.getClass().getSimpleName()), message,
                FailureType.PERMANENT, e, operation);
    }

    // A negative delay from the remote side is ignored, as if no hint had been given
    private static Duration retryAfterOf(Exception e) {
        if (!(e instanceof RetryAfterHint hint)) {
            return null;
        }
        Duration retryAfter = hint.retryAfter();
        return retryAfter == null || retryAfter.isNegative() ? null : retryAfter;
    }

    private Failure failure(FailureCode code, String message, FailureType type, Exception e, String operation) {
        return new Failure(code, message, type, e, null, operation, clock.instant());
    }
}

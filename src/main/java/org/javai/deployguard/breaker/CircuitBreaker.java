package org.javai.deployguard.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.deployguard.boundary.ThrowingSupplier;

/**
 * Guards calls to one named dependency with a Closed / Open / Half-Open state machine.
 *
 * <ul>
 *   <li>CLOSED: calls pass through. Each failure increments a consecutive-failure counter and
 *       each success resets it; reaching {@code failureThreshold} opens the circuit.</li>
 *   <li>OPEN: calls fail fast with {@link CircuitOpenException} and the operation is never
 *       invoked. Once {@code cooldown} has elapsed the next call moves the circuit to HALF_OPEN.</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxConcurrent} probes run at once; extra calls fail
 *       fast. Any probe failure reopens the circuit and restarts the cooldown;
 *       {@code successThreshold} consecutive successes close it.</li>
 * </ul>
 *
 * <p>All state is guarded by one lock. A call admitted under an earlier state does not
 * affect the counters of a later one: each admission is stamped with a generation that
 * advances on every transition.</p>
 *
 * <p>A call that ends in {@link InterruptedException} or {@link CancellationException} was
 * abandoned by its caller, not refused by the dependency: it gives back its permit and
 * counts as neither success nor failure.</p>
 *
 * <p>The breaker never retries. It only decides whether an attempt may run; wrap it in a
 * {@link org.javai.deployguard.retry.Retrier} to retry:</p>
 * <pre>{@code
 * CircuitBreaker breaker = registry.get("provisioning-api");
 * RetryResult<Workspace> result = retrier.execute(
 *     "WorkspaceApi.create", breaker.guard(() -> api.createWorkspace(request)), classifier);
 * }</pre>
 */
public final class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long generation;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int halfOpenInFlight;
    private Instant openedAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), CircuitBreakerListener.noOp());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, CircuitBreakerListener listener) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * Wraps an operation so that every invocation goes through this breaker.
     *
     * @param work the operation to protect
     * @return an operation that throws {@link CircuitOpenException} instead of calling
     *         {@code work} while the circuit refuses calls, and otherwise rethrows whatever
     *         {@code work} throws unchanged
     */
    public <T> ThrowingSupplier<T, Exception> guard(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(work);
    }

    /**
     * Runs an operation through this breaker.
     *
     * @throws CircuitOpenException if the circuit refuses the call; {@code work} did not run
     * @throws Exception whatever {@code work} threw, unchanged
     */
    public <T> T call(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        Permit permit = acquire();
        CallResult callResult = CallResult.FAILURE;
        try {
            T result = work.get();
            callResult = CallResult.SUCCESS;
            return result;
        } catch (Exception e) {
            if (e instanceof InterruptedException || e instanceof CancellationException) {
                callResult = CallResult.CANCELLED;
            }
            throw e;
        } finally {
            complete(permit, callResult);
        }
    }

    public CircuitBreakerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(
                    name,
                    state,
                    consecutiveFailures,
                    consecutiveSuccesses,
                    halfOpenInFlight,
                    openedAt,
                    remainingCooldown(clock.instant()),
                    config);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit closed and clears all counters.
     */
    public void reset() {
        CircuitBreakerTransition transition = null;
        lock.lock();
        try {
            if (state != CircuitBreakerState.CLOSED) {
                transition = transitionTo(CircuitBreakerState.CLOSED);
            } else {
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private Permit acquire() throws CircuitOpenException {
        CircuitBreakerTransition transition = null;
        Permit permit;
        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN) {
                Duration remaining = remainingCooldown(clock.instant());
                if (!remaining.isZero()) {
                    throw new CircuitOpenException(name, CircuitOpenException.Reason.OPEN, remaining);
                }
                transition = transitionTo(CircuitBreakerState.HALF_OPEN);
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (halfOpenInFlight >= config.halfOpenMaxConcurrent()) {
                    throw new CircuitOpenException(name, CircuitOpenException.Reason.HALF_OPEN_LIMIT_REACHED, Duration.ZERO);
                }
                halfOpenInFlight++;
                permit = new Permit(generation, true);
            } else {
                permit = new Permit(generation, false);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
        return permit;
    }

    private void complete(Permit permit, CallResult callResult) {
        CircuitBreakerTransition transition = null;
        lock.lock();
        try {
            if (permit.generation() != generation) {
                // Admitted under a previous state; its outcome no longer applies
                return;
            }
            if (permit.halfOpen()) {
                halfOpenInFlight--;
            }
            transition = switch (callResult) {
                case SUCCESS -> onSuccess();
                case FAILURE -> onFailure();
                case CANCELLED -> null;
            };
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private CircuitBreakerTransition onSuccess() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            consecutiveSuccesses++;
            if (consecutiveSuccesses >= config.successThreshold()) {
                return transitionTo(CircuitBreakerState.CLOSED);
            }
        } else if (state == CircuitBreakerState.CLOSED) {
            consecutiveFailures = 0;
        }
        return null;
    }

    private CircuitBreakerTransition onFailure() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            return transitionTo(CircuitBreakerState.OPEN);
        }
        if (state == CircuitBreakerState.CLOSED) {
            consecutiveFailures++;
            if (consecutiveFailures >= config.failureThreshold()) {
                return transitionTo(CircuitBreakerState.OPEN);
            }
        }
        return null;
    }

    // Caller holds the lock
    private CircuitBreakerTransition transitionTo(CircuitBreakerState target) {
        Instant now = clock.instant();
        CircuitBreakerState from = state;
        state = target;
        generation++;
        halfOpenInFlight = 0;
        consecutiveSuccesses = 0;
        switch (target) {
            case OPEN -> openedAt = now;
            case HALF_OPEN -> { }
            case CLOSED -> {
                consecutiveFailures = 0;
                openedAt = null;
            }
        }
        return new CircuitBreakerTransition(name, from, target, now);
    }

    // Caller holds the lock
    private Duration remainingCooldown(Instant now) {
        if (state != CircuitBreakerState.OPEN || openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, openedAt.plus(config.cooldown()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    // Listener failures are contained here; the transition has already been applied
    private void publish(CircuitBreakerTransition transition) {
        if (transition == null) {
            return;
        }
        try {
            listener.onTransition(transition);
        } catch (RuntimeException e) {
            LOG.error("Circuit breaker '{}' listener failed on {} -> {}",
                    name, transition.from(), transition.to(), e);
        }
    }

    private enum CallResult { SUCCESS, FAILURE, CANCELLED }

    private record Permit(long generation, boolean halfOpen) {}
}

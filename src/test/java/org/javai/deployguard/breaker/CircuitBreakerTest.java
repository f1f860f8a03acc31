package org.javai.deployguard.breaker;

import org.javai.deployguard.MutableClock;
import org.javai.deployguard.boundary.ThrowingSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<CircuitBreakerTransition> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        transitions = new ArrayList<>();
        breaker = new CircuitBreaker("arm-api",
                new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2, 1), clock, transitions::add);
    }

    @Test
    void closed_successPassesThrough() throws Exception {
        assertThat(breaker.call(() -> "ok")).isEqualTo("ok");
        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void closed_failureIsRethrownUnchanged() {
        IOException failure = new IOException("503");

        assertThatThrownBy(() -> breaker.call(() -> {
            throw failure;
        })).isSameAs(failure);
        assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void threeFailures_openCircuit_andFourthCallFailsFastWithoutRunning() {
        failTimes(3);
        AtomicInteger invocations = new AtomicInteger();

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> breaker.call(() -> invocations.incrementAndGet()))
                .isInstanceOfSatisfying(CircuitOpenException.class, e -> {
                    assertThat(e.reason()).isEqualTo(CircuitOpenException.Reason.OPEN);
                    assertThat(e.breakerName()).isEqualTo("arm-api");
                    assertThat(e.remainingCooldown()).isEqualTo(Duration.ofSeconds(30));
                });
        assertThat(invocations.get()).isZero();
        assertThat(transitions).singleElement().satisfies(t -> {
            assertThat(t.from()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(t.to()).isEqualTo(CircuitBreakerState.OPEN);
        });
    }

    @Test
    void successResetsConsecutiveFailures() throws Exception {
        failTimes(2);
        breaker.call(() -> "ok");
        failTimes(2);

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void afterCooldown_probeIsAdmittedAndSuccessesClose() throws Exception {
        failTimes(3);
        clock.advanceSeconds(30);

        breaker.call(() -> "probe 1");
        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        breaker.call(() -> "probe 2");

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isZero();
        assertThat(transitions).extracting(CircuitBreakerTransition::to).containsExactly(
                CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    void beforeCooldown_remainingTimeShrinks() {
        failTimes(3);
        clock.advanceSeconds(20);

        assertThat(breaker.snapshot().remainingCooldown()).isEqualTo(Duration.ofSeconds(10));
        assertThatThrownBy(() -> breaker.call(() -> "x")).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void halfOpen_failureReopensAndRestartsCooldown() {
        failTimes(3);
        clock.advanceSeconds(30);

        failTimes(1);

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
        assertThat(breaker.snapshot().remainingCooldown()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void halfOpen_extraConcurrentProbesFailFast() throws Exception {
        failTimes(3);
        clock.advanceSeconds(30);
        List<Throwable> rejected = new ArrayList<>();

        breaker.call(() -> {
            try {
                breaker.call(() -> "second probe");
            } catch (CircuitOpenException e) {
                rejected.add(e);
            }
            return "first probe";
        });

        assertThat(rejected).singleElement()
                .isInstanceOfSatisfying(CircuitOpenException.class,
                        e -> assertThat(e.reason()).isEqualTo(CircuitOpenException.Reason.HALF_OPEN_LIMIT_REACHED));
        assertThat(breaker.snapshot().halfOpenInFlight()).isZero();
    }

    @Test
    void callStartedBeforeTransition_doesNotAffectNewState() throws Exception {
        breaker.call(() -> {
            failTimes(3);
            return "slow success";
        });

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void guard_wrapsOperation() throws Exception {
        AtomicInteger invocations = new AtomicInteger();

        ThrowingSupplier<Integer, Exception> guarded = breaker.guard(() -> invocations.incrementAndGet());

        assertThat(guarded.get()).isEqualTo(1);
        assertThat(guarded.get()).isEqualTo(2);
    }

    @Test
    void reset_forcesClosed() {
        failTimes(3);

        breaker.reset();

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().openedAt()).isNull();
        assertThat(transitions).extracting(CircuitBreakerTransition::to)
                .containsExactly(CircuitBreakerState.OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    void interruptedCalls_areNotCountedAsFailures() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.call(() -> {
                throw new InterruptedException("caller gave up");
            })).isInstanceOf(InterruptedException.class);
        }

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot().consecutiveFailures()).isZero();
        assertThat(transitions).isEmpty();
    }

    @Test
    void halfOpen_cancelledProbeReleasesPermitWithoutReopening() throws Exception {
        failTimes(3);
        clock.advanceSeconds(30);

        assertThatThrownBy(() -> breaker.call(() -> {
            throw new CancellationException("deployment aborted");
        })).isInstanceOf(CancellationException.class);

        assertThat(breaker.state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.snapshot().halfOpenInFlight()).isZero();
        assertThat(breaker.call(() -> "next probe")).isEqualTo("next probe");
    }

    @Test
    void throwingListener_doesNotMaskTheOperationsException() {
        CircuitBreaker noisy = new CircuitBreaker("arm-api",
                new CircuitBreakerConfig(1, Duration.ofSeconds(30), 1, 1), clock, throwingListener());
        IOException root = new IOException("503");

        assertThatThrownBy(() -> noisy.call(() -> {
            throw root;
        })).isSameAs(root);
        assertThat(noisy.state()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void throwingListener_keepsHalfOpenProbeAndItsResult() throws Exception {
        CircuitBreaker noisy = new CircuitBreaker("arm-api",
                new CircuitBreakerConfig(1, Duration.ofSeconds(30), 2, 1), clock, throwingListener());
        assertThatThrownBy(() -> noisy.call(() -> {
            throw new IOException("503");
        })).isInstanceOf(IOException.class);
        clock.advanceSeconds(30);

        assertThat(noisy.call(() -> "probe 1")).isEqualTo("probe 1");
        assertThat(noisy.snapshot().halfOpenInFlight()).isZero();
        assertThat(noisy.call(() -> "probe 2")).isEqualTo("probe 2");

        assertThat(noisy.state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void invalidConfig_isRejected() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, Duration.ofSeconds(1), 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(-1), 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(1), 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CircuitBreakerListener throwingListener() {
        return transition -> {
            throw new IllegalStateException("listener failed on " + transition.to());
        };
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            try {
                breaker.call(() -> {
                    throw new IOException("503 Service Unavailable");
                });
                fail("expected failure");
            } catch (IOException expected) {
                // counted by the breaker
            } catch (Exception e) {
                fail("unexpected exception", e);
            }
        }
    }
}

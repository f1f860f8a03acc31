package org.javai.deployguard.breaker;

import org.javai.deployguard.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
    private final List<CircuitBreakerTransition> transitions = new ArrayList<>();
    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
            new CircuitBreakerConfig(1, Duration.ofSeconds(10), 1, 1), clock, transitions::add);

    @Test
    void get_sameName_returnsSameInstance() {
        assertThat(registry.get("graph-api")).isSameAs(registry.get("graph-api"));
        assertThat(registry.get("graph-api")).isNotSameAs(registry.get("arm-api"));
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void get_withConfig_appliesOnlyOnCreation() {
        CircuitBreakerConfig custom = new CircuitBreakerConfig(7, Duration.ofSeconds(5), 1, 1);

        CircuitBreaker first = registry.get("storage", custom);
        CircuitBreaker second = registry.get("storage", CircuitBreakerConfig.defaults());

        assertThat(second).isSameAs(first);
        assertThat(second.config()).isEqualTo(custom);
    }

    @Test
    void get_concurrentCallers_shareOneInstance() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<CircuitBreaker> seen = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    seen.add(registry.get("shared"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(1);
    }

    @Test
    void find_unknownName_isEmpty() {
        assertThat(registry.find("nope")).isEmpty();
        registry.get("known");
        assertThat(registry.find("known")).isPresent();
    }

    @Test
    void snapshots_areSortedAndResetAllCloses() {
        registry.get("b-api");
        CircuitBreaker a = registry.get("a-api");
        assertThatThrownBy(() -> a.call(() -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);

        assertThat(registry.snapshots()).extracting(CircuitBreakerSnapshot::name).containsExactly("a-api", "b-api");
        assertThat(registry.snapshots().get(0).state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(transitions).hasSize(1);

        registry.resetAll();

        assertThat(registry.snapshots()).extracting(CircuitBreakerSnapshot::state)
                .containsOnly(CircuitBreakerState.CLOSED);
    }
}

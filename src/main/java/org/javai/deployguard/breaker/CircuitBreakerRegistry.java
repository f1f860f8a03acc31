package org.javai.deployguard.breaker;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds exactly one {@link CircuitBreaker} per dependency name.
 *
 * <p>Breakers are created lazily on first lookup and never removed, so every caller that asks
 * for the same name shares one instance and sees the failures the others observed. The
 * registry is an ordinary object passed to whoever needs it; tests build their own.</p>
 */
public final class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final CircuitBreakerListener listener;

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults(), Clock.systemUTC(), CircuitBreakerListener.noOp());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock, CircuitBreakerListener listener) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Returns the breaker for a dependency, creating it with the default config on first use.
     */
    public CircuitBreaker get(String name) {
        return get(name, defaultConfig);
    }

    /**
     * Returns the breaker for a dependency, creating it with {@code config} on first use.
     * The config is ignored if the breaker already exists.
     */
    public CircuitBreaker get(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, config, clock, listener));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * @return snapshots of every registered breaker, ordered by name
     */
    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::name))
                .toList();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    public int size() {
        return breakers.size();
    }
}

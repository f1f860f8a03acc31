package org.javai.deployguard.ops.health;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.deployguard.breaker.CircuitBreakerSnapshot;
import org.javai.deployguard.breaker.CircuitBreakerState;
import org.javai.deployguard.secret.SecretCacheStats;
import org.javai.deployguard.toggle.Feature;
import org.javai.deployguard.transaction.TransactionSnapshot;

/**
 * Health of the engine's dependencies at one instant.
 *
 * @param timestamp when the report was taken
 * @param status the overall status, derived from the breaker states
 * @param circuitBreakers every known breaker, sorted by name
 * @param secretCache cache counters, or null when no cache is attached
 * @param activeTransactions deployments that have neither committed nor rolled back, oldest first
 * @param features the feature switches in effect, in declaration order
 */
public record HealthReport(
		Instant timestamp,
		Status status,
		List<CircuitBreakerSnapshot> circuitBreakers,
		SecretCacheStats secretCache,
		List<TransactionSnapshot> activeTransactions,
		Map<Feature, Boolean> features
) {

	public enum Status {
		HEALTHY,
		/** At least one dependency is being probed after an outage. */
		DEGRADED,
		/** At least one dependency is failing fast. */
		UNHEALTHY
	}

	public HealthReport {
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		Objects.requireNonNull(status, "status must not be null");
		circuitBreakers = List.copyOf(circuitBreakers);
		activeTransactions = List.copyOf(activeTransactions);
		EnumMap<Feature, Boolean> ordered = new EnumMap<>(Feature.class);
		ordered.putAll(features);
		features = Collections.unmodifiableMap(ordered);
	}

	/**
	 * Builds a report whose status is UNHEALTHY if any breaker is open, DEGRADED if any is
	 * half-open, and HEALTHY otherwise.
	 */
	public static HealthReport of(
			Instant timestamp,
			List<CircuitBreakerSnapshot> circuitBreakers,
			SecretCacheStats secretCache,
			List<TransactionSnapshot> activeTransactions,
			Map<Feature, Boolean> features
	) {
		return new HealthReport(timestamp, statusOf(circuitBreakers), circuitBreakers, secretCache,
				activeTransactions, features);
	}

	static Status statusOf(List<CircuitBreakerSnapshot> circuitBreakers) {
		Status status = Status.HEALTHY;
		for (CircuitBreakerSnapshot snapshot : circuitBreakers) {
			if (snapshot.state() == CircuitBreakerState.OPEN) {
				return Status.UNHEALTHY;
			}
			if (snapshot.state() == CircuitBreakerState.HALF_OPEN) {
				status = Status.DEGRADED;
			}
		}
		return status;
	}
}

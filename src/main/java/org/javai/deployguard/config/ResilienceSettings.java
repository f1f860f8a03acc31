package org.javai.deployguard.config;

import java.time.Duration;
import java.util.Objects;
import org.javai.deployguard.breaker.CircuitBreakerConfig;
import org.javai.deployguard.retry.RetryConfig;

/**
 * Every tunable of the engine, resolved once from the environment and passed around as values.
 *
 * <table>
 *   <caption>Keys (environment-variable form) and defaults</caption>
 *   <tr><td>RETRY_MAX_ATTEMPTS</td><td>3</td></tr>
 *   <tr><td>RETRY_INITIAL_DELAY_MS</td><td>1000</td></tr>
 *   <tr><td>RETRY_MAX_DELAY_MS</td><td>60000</td></tr>
 *   <tr><td>RETRY_BACKOFF_FACTOR</td><td>2.0</td></tr>
 *   <tr><td>RETRY_JITTER_FRACTION</td><td>0.1</td></tr>
 *   <tr><td>CIRCUIT_FAILURE_THRESHOLD</td><td>5</td></tr>
 *   <tr><td>CIRCUIT_COOLDOWN_SECONDS</td><td>60</td></tr>
 *   <tr><td>CIRCUIT_SUCCESS_THRESHOLD</td><td>2</td></tr>
 *   <tr><td>CIRCUIT_HALF_OPEN_MAX_CALLS</td><td>3</td></tr>
 *   <tr><td>SECRET_CACHE_TTL</td><td>3600 (seconds)</td></tr>
 * </table>
 *
 * @param retry backoff tunables
 * @param circuitBreaker default breaker thresholds
 * @param secretCacheTtl how long a fetched secret stays fresh
 */
public record ResilienceSettings(
		RetryConfig retry,
		CircuitBreakerConfig circuitBreaker,
		Duration secretCacheTtl
) {

	public static final String RETRY_MAX_ATTEMPTS = "RETRY_MAX_ATTEMPTS";
	public static final String RETRY_INITIAL_DELAY_MS = "RETRY_INITIAL_DELAY_MS";
	public static final String RETRY_MAX_DELAY_MS = "RETRY_MAX_DELAY_MS";
	public static final String RETRY_BACKOFF_FACTOR = "RETRY_BACKOFF_FACTOR";
	public static final String RETRY_JITTER_FRACTION = "RETRY_JITTER_FRACTION";
	public static final String CIRCUIT_FAILURE_THRESHOLD = "CIRCUIT_FAILURE_THRESHOLD";
	public static final String CIRCUIT_COOLDOWN_SECONDS = "CIRCUIT_COOLDOWN_SECONDS";
	public static final String CIRCUIT_SUCCESS_THRESHOLD = "CIRCUIT_SUCCESS_THRESHOLD";
	public static final String CIRCUIT_HALF_OPEN_MAX_CALLS = "CIRCUIT_HALF_OPEN_MAX_CALLS";
	public static final String SECRET_CACHE_TTL = "SECRET_CACHE_TTL";

	public ResilienceSettings {
		Objects.requireNonNull(retry, "retry must not be null");
		Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
		Objects.requireNonNull(secretCacheTtl, "secretCacheTtl must not be null");
		if (secretCacheTtl.isNegative()) {
			throw new IllegalArgumentException("secretCacheTtl must not be negative");
		}
	}

	public static ResilienceSettings defaults() {
		return new ResilienceSettings(RetryConfig.defaults(), CircuitBreakerConfig.defaults(), Duration.ofHours(1));
	}

	/**
	 * Reads every setting, falling back to {@link #defaults()} for unset keys.
	 *
	 * @throws IllegalStateException if a value is not a number
	 * @throws IllegalArgumentException if a value is out of range
	 */
	public static ResilienceSettings load(ConfigResolver config) {
		Objects.requireNonNull(config, "config must not be null");
		ResilienceSettings defaults = defaults();
		RetryConfig retryDefaults = defaults.retry();
		CircuitBreakerConfig breakerDefaults = defaults.circuitBreaker();

		RetryConfig retry = new RetryConfig(
				config.getInt(RETRY_MAX_ATTEMPTS, retryDefaults.maxAttempts()),
				Duration.ofMillis(config.getLong(RETRY_INITIAL_DELAY_MS, retryDefaults.initialDelay().toMillis())),
				Duration.ofMillis(config.getLong(RETRY_MAX_DELAY_MS, retryDefaults.maxDelay().toMillis())),
				config.getDouble(RETRY_BACKOFF_FACTOR, retryDefaults.backoffFactor()),
				config.getDouble(RETRY_JITTER_FRACTION, retryDefaults.jitterFraction()));

		CircuitBreakerConfig breaker = new CircuitBreakerConfig(
				config.getInt(CIRCUIT_FAILURE_THRESHOLD, breakerDefaults.failureThreshold()),
				Duration.ofSeconds(config.getLong(CIRCUIT_COOLDOWN_SECONDS, breakerDefaults.cooldown().toSeconds())),
				config.getInt(CIRCUIT_SUCCESS_THRESHOLD, breakerDefaults.successThreshold()),
				config.getInt(CIRCUIT_HALF_OPEN_MAX_CALLS, breakerDefaults.halfOpenMaxConcurrent()));

		Duration ttl = Duration.ofSeconds(config.getLong(SECRET_CACHE_TTL, defaults.secretCacheTtl().toSeconds()));

		return new ResilienceSettings(retry, breaker, ttl);
	}
}

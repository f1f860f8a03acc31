package org.javai.deployguard.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration values from system properties, then environment variables.
 *
 * <p>Keys are given in environment-variable form ({@code RETRY_MAX_ATTEMPTS}). The matching
 * system property is the key lower-cased, with underscores turned into dots and a
 * {@code deployguard.} prefix ({@code deployguard.retry.max.attempts}); it wins when both are set.
 * Blank values count as unset.</p>
 */
public final class ConfigResolver {

	private static final String PROPERTY_PREFIX = "deployguard.";

	private final Function<String, String> systemProperties;
	private final Function<String, String> environment;

	public ConfigResolver(Function<String, String> systemProperties, Function<String, String> environment) {
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Resolves against the JVM's system properties and the process environment.
	 */
	public static ConfigResolver system() {
		return new ConfigResolver(System::getProperty, System::getenv);
	}

	/**
	 * Resolves against a fixed map keyed by environment-variable names. Useful for testing.
	 */
	public static ConfigResolver of(Map<String, String> values) {
		Map<String, String> copy = Map.copyOf(values);
		return new ConfigResolver(key -> null, copy::get);
	}

	public static String propertyName(String key) {
		return PROPERTY_PREFIX + key.toLowerCase(Locale.ROOT).replace('_', '.');
	}

	public Optional<String> find(String key) {
		Objects.requireNonNull(key, "key must not be null");
		String value = systemProperties.apply(propertyName(key));
		if (value == null || value.isBlank()) {
			value = environment.apply(key);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * @throws IllegalStateException if the key is not set anywhere
	 */
	public String require(String key) {
		return find(key).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + propertyName(key) +
				"' or environment variable '" + key + "'"));
	}

	public int getInt(String key, int defaultValue) {
		return find(key).map(value -> parse(key, value, Integer::parseInt)).orElse(defaultValue);
	}

	public long getLong(String key, long defaultValue) {
		return find(key).map(value -> parse(key, value, Long::parseLong)).orElse(defaultValue);
	}

	public double getDouble(String key, double defaultValue) {
		return find(key).map(value -> parse(key, value, Double::parseDouble)).orElse(defaultValue);
	}

	/**
	 * Only {@code true} (any case) enables a flag; any other non-blank value disables it.
	 */
	public boolean getBoolean(String key, boolean defaultValue) {
		return find(key).map("true"::equalsIgnoreCase).orElse(defaultValue);
	}

	private static <T> T parse(String key, String value, Function<String, T> parser) {
		try {
			return parser.apply(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Invalid value for configuration '" + key + "': " + value, e);
		}
	}
}

package org.javai.deployguard.toggle;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.deployguard.config.ConfigResolver;

/**
 * Read-only lookup of {@link Feature} switches.
 *
 * <p>Every call reads the underlying source; nothing is cached. A feature whose key is unset
 * takes its static default, {@code true} in any case turns it on, and any other value turns it off.</p>
 */
public final class FeatureToggles {

	private final ConfigResolver source;

	public FeatureToggles(ConfigResolver source) {
		this.source = Objects.requireNonNull(source, "source must not be null");
	}

	/**
	 * Toggles backed by system properties and environment variables.
	 */
	public static FeatureToggles fromEnvironment() {
		return new FeatureToggles(ConfigResolver.system());
	}

	/**
	 * Toggles that always report each feature's static default.
	 */
	public static FeatureToggles defaults() {
		return new FeatureToggles(ConfigResolver.of(Map.of()));
	}

	/**
	 * Toggles with explicit values; features not mentioned keep their defaults.
	 */
	public static FeatureToggles of(Map<Feature, Boolean> values) {
		Map<String, String> byKey = new HashMap<>();
		values.forEach((feature, enabled) -> byKey.put(feature.key(), String.valueOf(enabled)));
		return new FeatureToggles(ConfigResolver.of(byKey));
	}

	public boolean isEnabled(Feature feature) {
		Objects.requireNonNull(feature, "feature must not be null");
		return source.getBoolean(feature.key(), feature.enabledByDefault());
	}

	/**
	 * @return the current value of every feature, in declaration order
	 */
	public Map<Feature, Boolean> status() {
		Map<Feature, Boolean> status = new EnumMap<>(Feature.class);
		for (Feature feature : Feature.values()) {
			status.put(feature, isEnabled(feature));
		}
		return status;
	}
}

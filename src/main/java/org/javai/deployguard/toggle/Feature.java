package org.javai.deployguard.toggle;

/**
 * Switches for the hardening features, each with the environment variable that controls it
 * and the value it takes when that variable is unset.
 */
public enum Feature {
	USE_RETRY("FEATURE_USE_RETRY_LOGIC", true),
	USE_CIRCUIT_BREAKER("FEATURE_USE_CIRCUIT_BREAKER", true),
	USE_REMOTE_SECRET_STORE("FEATURE_USE_KEY_VAULT", false),
	USE_ROLLBACK("FEATURE_USE_ROLLBACK", true);

	private final String key;
	private final boolean enabledByDefault;

	Feature(String key, boolean enabledByDefault) {
		this.key = key;
		this.enabledByDefault = enabledByDefault;
	}

	public String key() {
		return key;
	}

	public boolean enabledByDefault() {
		return enabledByDefault;
	}
}

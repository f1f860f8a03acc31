package org.javai.deployguard.secret;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads secrets from system properties and environment variables.
 *
 * <p>A secret named {@code workspace-api-key} is looked up as {@code WORKSPACE_API_KEY} first,
 * then as {@code workspace-api-key}; each candidate is tried as a system property before the
 * environment. Blank values are ignored.</p>
 */
public final class EnvironmentSecretSource implements LocalSecretSource {

    private final Function<String, String> systemProperties;
    private final Function<String, String> environment;

    public EnvironmentSecretSource() {
        this(System::getProperty, System::getenv);
    }

    public EnvironmentSecretSource(Function<String, String> systemProperties, Function<String, String> environment) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }

    @Override
    public Optional<String> lookup(String name) {
        Objects.requireNonNull(name, "name must not be null");
        List<String> candidates = new ArrayList<>(2);
        candidates.add(normalize(name));
        if (!candidates.contains(name)) {
            candidates.add(name);
        }
        for (String candidate : candidates) {
            String value = systemProperties.apply(candidate);
            if (value == null || value.isBlank()) {
                value = environment.apply(candidate);
            }
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

package org.javai.deployguard.secret;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EnvironmentSecretSourceTest {

    @Test
    void lookup_prefersNormalizedName() {
        EnvironmentSecretSource source = new EnvironmentSecretSource(
                key -> null,
                Map.of("WORKSPACE_API_KEY", "upper", "workspace-api-key", "as-given")::get);

        assertThat(source.lookup("workspace-api-key")).contains("upper");
    }

    @Test
    void lookup_fallsBackToNameAsGiven() {
        EnvironmentSecretSource source = new EnvironmentSecretSource(
                key -> null,
                Map.of("workspace-api-key", "as-given")::get);

        assertThat(source.lookup("workspace-api-key")).contains("as-given");
    }

    @Test
    void lookup_systemPropertyWinsOverEnvironment() {
        EnvironmentSecretSource source = new EnvironmentSecretSource(
                Map.of("DB_PASSWORD", "from-property")::get,
                Map.of("DB_PASSWORD", "from-env")::get);

        assertThat(source.lookup("db.password")).contains("from-property");
    }

    @Test
    void lookup_blankValue_isIgnored() {
        EnvironmentSecretSource source = new EnvironmentSecretSource(key -> "  ", key -> null);

        assertThat(source.lookup("db-password")).isEmpty();
    }

    @Test
    void normalize_upperCasesAndReplacesSeparators() {
        assertThat(EnvironmentSecretSource.normalize("storage.account-key")).isEqualTo("STORAGE_ACCOUNT_KEY");
    }
}

package org.javai.deployguard.ops.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.deployguard.breaker.CircuitBreakerConfig;
import org.javai.deployguard.breaker.CircuitBreakerSnapshot;
import org.javai.deployguard.breaker.CircuitBreakerState;
import org.javai.deployguard.secret.SecretCacheStats;
import org.javai.deployguard.toggle.Feature;
import org.javai.deployguard.transaction.TransactionSnapshot;
import org.javai.deployguard.transaction.TransactionStatus;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HealthReportWriterTest {

	private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

	@Test
	void status_anyOpenBreakerIsUnhealthy() {
		assertThat(HealthReport.statusOf(List.of(breaker("a", CircuitBreakerState.HALF_OPEN),
				breaker("b", CircuitBreakerState.OPEN)))).isEqualTo(HealthReport.Status.UNHEALTHY);
	}

	@Test
	void status_halfOpenIsDegraded() {
		assertThat(HealthReport.statusOf(List.of(breaker("a", CircuitBreakerState.CLOSED),
				breaker("b", CircuitBreakerState.HALF_OPEN)))).isEqualTo(HealthReport.Status.DEGRADED);
	}

	@Test
	void status_allClosedOrNoneIsHealthy() {
		assertThat(HealthReport.statusOf(List.of())).isEqualTo(HealthReport.Status.HEALTHY);
		assertThat(HealthReport.statusOf(List.of(breaker("a", CircuitBreakerState.CLOSED))))
				.isEqualTo(HealthReport.Status.HEALTHY);
	}

	@Test
	void toJson_rendersIsoTimesAndBreakerDetails() throws Exception {
		HealthReport report = HealthReport.of(NOW,
				List.of(breaker("arm", CircuitBreakerState.OPEN)),
				new SecretCacheStats(2, 1, 10, 2, 0, Duration.ofHours(1), true),
				List.of(transaction("deploy-analytics")),
				Map.of(Feature.USE_RETRY, true));

		JsonNode json = new ObjectMapper().readTree(new HealthReportWriter().toJson(report));

		assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
		assertThat(json.get("status").asText()).isEqualTo("UNHEALTHY");
		JsonNode arm = json.get("circuitBreakers").get(0);
		assertThat(arm.get("name").asText()).isEqualTo("arm");
		assertThat(arm.get("state").asText()).isEqualTo("OPEN");
		assertThat(arm.get("remainingCooldown").asText()).isEqualTo("PT45S");
		assertThat(arm.get("config").get("failureThreshold").asInt()).isEqualTo(5);
		assertThat(json.get("secretCache").get("hits").asLong()).isEqualTo(10);
		assertThat(json.get("secretCache").get("ttl").asText()).isEqualTo("PT1H");
		assertThat(json.get("features").get("USE_RETRY").asBoolean()).isTrue();
		JsonNode active = json.get("activeTransactions").get(0);
		assertThat(active.get("name").asText()).isEqualTo("deploy-analytics");
		assertThat(active.get("status").asText()).isEqualTo("ACTIVE");
		assertThat(active.get("resources").get(0).asText()).isEqualTo("workspace 'analytics' (ws-1)");
	}

	@Test
	void toJson_listsFeaturesInDeclarationOrder() throws Exception {
		Map<Feature, Boolean> features = new HashMap<>();
		for (Feature feature : Feature.values()) {
			features.put(feature, feature.enabledByDefault());
		}
		HealthReport report = HealthReport.of(NOW, List.of(), null, List.of(), features);

		JsonNode json = new ObjectMapper().readTree(new HealthReportWriter().toJson(report));

		List<String> names = new ArrayList<>();
		json.get("features").fieldNames().forEachRemaining(names::add);
		assertThat(names).containsExactly(Arrays.stream(Feature.values()).map(Feature::name).toArray(String[]::new));
	}

	@Test
	void write_withoutSecretCache_writesNull() throws Exception {
		HealthReport report = HealthReport.of(NOW, List.of(), null, List.of(), Map.of());
		StringWriter out = new StringWriter();

		new HealthReportWriter(true).write(report, out);

		JsonNode json = new ObjectMapper().readTree(out.toString());
		assertThat(json.get("status").asText()).isEqualTo("HEALTHY");
		assertThat(json.get("secretCache").isNull()).isTrue();
		assertThat(json.get("activeTransactions").size()).isZero();
		assertThat(out.toString()).contains("\n");
	}

	private static TransactionSnapshot transaction(String name) {
		return new TransactionSnapshot(name, TransactionStatus.ACTIVE, false, true,
				NOW.minusSeconds(30), null, Duration.ofSeconds(30),
				List.of("workspace 'analytics' (ws-1)"), List.of());
	}

	private static CircuitBreakerSnapshot breaker(String name, CircuitBreakerState state) {
		boolean open = state == CircuitBreakerState.OPEN;
		return new CircuitBreakerSnapshot(name, state, open ? 5 : 0, 0, 0,
				open ? NOW.minusSeconds(15) : null,
				open ? Duration.ofSeconds(45) : Duration.ZERO,
				CircuitBreakerConfig.defaults());
	}
}

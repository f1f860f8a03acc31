package org.javai.deployguard.ops.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import org.javai.deployguard.Failure;
import org.javai.deployguard.breaker.CircuitBreakerTransition;
import org.javai.deployguard.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports failures and resilience events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object on one line, suitable for metrics aggregation.
 * The tracking key is the operation (or breaker) name, optionally prefixed with a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"deploy.WorkspaceApi.create","attemptNumber":1,"delayMs":1000,...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.deployguard.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final ObjectMapper mapper = new ObjectMapper();
	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsOpReporter with explicit configuration.
	 * Package-private for testing.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param logger the SLF4J logger to use
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode event = failureEvent("failure", failure);
		event.put("message", failure.message());
		logger.info(event.toString());
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		ObjectNode event = failureEvent("retry_attempt", failure);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("policy", policyId);
		logger.info(event.toString());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		ObjectNode event = failureEvent("retry_exhausted", failure);
		event.put("totalAttempts", totalAttempts);
		event.put("policy", policyId);
		logger.info(event.toString());
	}

	@Override
	public void reportCircuitTransition(CircuitBreakerTransition transition) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", "circuit_transition");
		event.put("timestamp", ISO_FORMATTER.format(transition.at()));
		event.put("trackingKey", trackingKey(transition.breakerName()));
		event.put("from", transition.from().name());
		event.put("to", transition.to().name());
		logger.info(event.toString());
	}

	String trackingKey(String name) {
		if (namespace == null) {
			return name;
		}
		return namespace + "." + name;
	}

	private ObjectNode failureEvent(String eventType, Failure failure) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		event.put("trackingKey", trackingKey(failure.operation()));
		event.put("code", failure.code().toString());
		event.put("type", failure.type().name());
		event.put("operation", failure.operation());
		return event;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}

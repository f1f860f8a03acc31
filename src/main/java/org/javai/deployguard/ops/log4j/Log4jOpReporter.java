package org.javai.deployguard.ops.log4j;

import java.time.Duration;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.deployguard.Failure;
import org.javai.deployguard.FailureType;
import org.javai.deployguard.breaker.CircuitBreakerState;
import org.javai.deployguard.breaker.CircuitBreakerTransition;
import org.javai.deployguard.ops.OpReporter;

/**
 * Reports failures and resilience events using Log4j2.
 *
 * <p>Log levels:
 * <ul>
 *   <li>retry attempt → WARN (a dependency is misbehaving)</li>
 *   <li>retry exhausted → ERROR</li>
 *   <li>permanent or circuit-open failure → WARN, cancelled → INFO</li>
 *   <li>circuit opened → ERROR, half-open → INFO, closed → INFO</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.deployguard.OpReporter"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.log(levelFor(failure.type()), FAILURE_MARKER,
			"Failure in operation [{}]: {} | code={}, type={}",
			failure.operation(),
			failure.message(),
			failure.code(),
			failure.type());
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		logger.warn(RETRY_MARKER,
			"Retry attempt {} failed for operation [{}] with policy [{}]; waiting {}ms. Code: {}, Message: {}",
			attemptNumber,
			failure.operation(),
			policyId,
			delay.toMillis(),
			failure.code(),
			failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		logger.error(RETRY_EXHAUSTED_MARKER,
			"Retry exhausted for operation [{}] after {} attempts with policy [{}]. Code: {}, Message: {}",
			failure.operation(),
			totalAttempts,
			policyId,
			failure.code(),
			failure.message());
	}

	@Override
	public void reportCircuitTransition(CircuitBreakerTransition transition) {
		Level level = transition.to() == CircuitBreakerState.OPEN ? Level.ERROR : Level.INFO;
		logger.log(level, CIRCUIT_MARKER,
			"Circuit breaker '{}' transitioned {} -> {}",
			transition.breakerName(),
			transition.from(),
			transition.to());
	}

	private static Level levelFor(FailureType type) {
		return switch (type) {
			case TRANSIENT, PERMANENT, CIRCUIT_OPEN -> Level.WARN;
			case CANCELLED -> Level.INFO;
		};
	}
}

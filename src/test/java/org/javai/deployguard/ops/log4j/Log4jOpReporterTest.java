package org.javai.deployguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.javai.deployguard.Failure;
import org.javai.deployguard.FailureCode;
import org.javai.deployguard.breaker.CircuitBreakerState;
import org.javai.deployguard.breaker.CircuitBreakerTransition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	private static final String LOGGER_NAME = "test.Log4jOpReporter";

	private CapturingAppender appender;
	private Log4jOpReporter reporter;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration config = context.getConfiguration();
		appender = new CapturingAppender();
		appender.start();
		config.addAppender(appender);
		LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
		loggerConfig.addAppender(appender, Level.ALL, null);
		config.addLogger(LOGGER_NAME, loggerConfig);
		context.updateLoggers();
		reporter = new Log4jOpReporter(LOGGER_NAME);
	}

	@AfterEach
	void tearDown() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		context.getConfiguration().removeLogger(LOGGER_NAME);
		context.updateLoggers();
		appender.stop();
	}

	@Test
	void reportRetryAttempt_logsWarnWithRetryMarker() {
		reporter.reportRetryAttempt(failure(), 2, Duration.ofMillis(400), "deployment");

		LogEvent event = single();
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
				.contains("Retry attempt 2")
				.contains("WorkspaceApi.create")
				.contains("400ms")
				.contains("transient:IOException");
	}

	@Test
	void reportRetryExhausted_logsError() {
		reporter.reportRetryExhausted(failure(), 5, "deployment");

		LogEvent event = single();
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY_EXHAUSTED");
		assertThat(event.getMessage().getFormattedMessage()).contains("after 5 attempts");
	}

	@Test
	void reportCircuitTransition_openIsErrorOthersInfo() {
		reporter.reportCircuitTransition(transition(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN));
		reporter.reportCircuitTransition(transition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN));

		assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.ERROR, Level.INFO);
		assertThat(appender.events.get(0).getMessage().getFormattedMessage())
				.isEqualTo("Circuit breaker 'arm' transitioned CLOSED -> OPEN");
	}

	@Test
	void report_cancelledIsInfo() {
		reporter.report(Failure.cancelled("stopped", "Op", null));

		assertThat(single().getLevel()).isEqualTo(Level.INFO);
	}

	private LogEvent single() {
		assertThat(appender.events).hasSize(1);
		return appender.events.get(0);
	}

	private static Failure failure() {
		return Failure.transientFailure(FailureCode.of("transient", "IOException"), "503 Service Unavailable",
				"WorkspaceApi.create", null);
	}

	private static CircuitBreakerTransition transition(CircuitBreakerState from, CircuitBreakerState to) {
		return new CircuitBreakerTransition("arm", from, to, Instant.parse("2024-03-01T12:00:00Z"));
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new CopyOnWriteArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}

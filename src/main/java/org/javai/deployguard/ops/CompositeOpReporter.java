package org.javai.deployguard.ops;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.deployguard.Failure;
import org.javai.deployguard.breaker.CircuitBreakerTransition;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is logged and the remaining reporters still execute.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("deploy")
 * );
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger LOG = LogManager.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyId) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts, policyId));
	}

	@Override
	public void reportCircuitTransition(CircuitBreakerTransition transition) {
		fanOut("reportCircuitTransition", reporter -> reporter.reportCircuitTransition(transition));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOG.error("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}

package org.javai.deployguard.ops.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Renders a {@link HealthReport} as JSON.
 *
 * <p>Instants are written as ISO-8601 strings and durations as ISO-8601 periods
 * ({@code PT45S}).</p>
 */
public final class HealthReportWriter {

	private final ObjectMapper mapper;

	public HealthReportWriter() {
		this(false);
	}

	/**
	 * @param pretty indent the output
	 */
	public HealthReportWriter(boolean pretty) {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
				.configure(SerializationFeature.INDENT_OUTPUT, pretty);
	}

	public String toJson(HealthReport report) {
		try {
			return mapper.writeValueAsString(report);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialise health report", e);
		}
	}

	public void write(HealthReport report, Writer out) {
		try {
			mapper.writeValue(out, report);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write health report", e);
		}
	}
}

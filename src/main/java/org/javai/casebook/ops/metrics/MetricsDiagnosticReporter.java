package org.javai.casebook.ops.metrics;

import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;
import org.javai.casebook.ops.DiagnosticReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;

/**
 * Reports diagnostics as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object. The tracking key is the reported fault's code,
 * prefixed with an optional namespace, so that counts can be aggregated per outcome.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"dispatched","timestamp":"2024-01-20T10:30:00Z","trackingKey":"billing.storage:disk_full","code":"exception:IOException",...}
 * }</pre>
 */
public class MetricsDiagnosticReporter implements DiagnosticReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.casebook.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;

	public MetricsDiagnosticReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsDiagnosticReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsDiagnosticReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsDiagnosticReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void reportUnmatched(FailureRecord record, Classification classification) {
		logger.info(buildEventJson("unmatched", record, classification));
	}

	@Override
	public void reportDispatched(FailureRecord record, Classification classification) {
		logger.info(buildEventJson("dispatched", record, classification));
	}

	@Override
	public void reportUnguarded(FailureRecord record, Thread thread) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "unguarded", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(record.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(record.fault().code().toString()), false);
		appendField(sb, "code", record.fault().code().toString(), false);
		appendField(sb, "thread", thread.getName(), false);
		sb.append("}");
		logger.info(sb.toString());
	}

	private String buildEventJson(String eventType, FailureRecord record, Classification classification) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", eventType, true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(record.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(classification.result().code().toString()), false);
		appendField(sb, "code", record.fault().code().toString(), false);
		appendField(sb, "reported", classification.result().code().toString(), false);
		appendField(sb, "tier", classification.tier().name(), false);
		appendField(sb, "detected", String.valueOf(record.detected()), false);
		appendField(sb, "message", record.message(), false);
		appendField(sb, "thread", record.threadName(), false);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(String code) {
		if (namespace == null) {
			return code;
		}
		return namespace + "." + code;
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}
}

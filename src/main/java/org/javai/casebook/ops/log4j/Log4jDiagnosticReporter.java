package org.javai.casebook.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;
import org.javai.casebook.classify.MatchTier;
import org.javai.casebook.ops.DiagnosticReporter;

/**
 * Reports diagnostics using Log4j2.
 *
 * <ul>
 *   <li>Unmatched faults are logged at ERROR with the {@code UNMATCHED} marker, carrying
 *       the original message and the captured trace, so that missing rules are loud.</li>
 *   <li>Recovered failures are logged with the {@code FAILURE} marker: ERROR for violated
 *       assertions, WARN for failures reported by delegated operations. An unmatched
 *       failure already has its {@code UNMATCHED} line and is not logged again.</li>
 *   <li>Signals that escaped every guard are logged at ERROR with the {@code UNGUARDED} marker.</li>
 * </ul>
 */
public class Log4jDiagnosticReporter implements DiagnosticReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.casebook.Diagnostics";

	private static final Marker UNMATCHED_MARKER = MarkerManager.getMarker("UNMATCHED");
	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker UNGUARDED_MARKER = MarkerManager.getMarker("UNGUARDED");

	private final Logger logger;

	public Log4jDiagnosticReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	public Log4jDiagnosticReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jDiagnosticReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportUnmatched(FailureRecord record, Classification classification) {
		logger.atError()
			.withMarker(UNMATCHED_MARKER)
			.log("No classification rule for fault [{}]: {} | reported as {}{}",
				record.fault().code(),
				record.message(),
				classification.result().code(),
				formatTrace(record.trace()));
	}

	@Override
	public void reportDispatched(FailureRecord record, Classification classification) {
		if (classification.tier() == MatchTier.UNMATCHED) {
			return;
		}
		Level level = record.detected() ? Level.WARN : Level.ERROR;

		logger.atLevel(level)
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(record, classification));
	}

	@Override
	public void reportUnguarded(FailureRecord record, Thread thread) {
		logger.atError()
			.withMarker(UNGUARDED_MARKER)
			.log("Failure signal escaped every guard on thread [{}]: {}{}",
				thread.getName(),
				record.message(),
				formatTrace(record.trace()));
	}

	private static String formatFailureMessage(FailureRecord record, Classification classification) {
		return """
			%s on thread [%s]: %s \
			| code=%s, reported=%s, tier=%s\
			""".formatted(
				record.detected() ? "Failure detected" : "Assertion failed",
				record.threadName(),
				record.message(),
				record.fault().code(),
				classification.result().code(),
				classification.tier()
			).trim();
	}

	private static String formatTrace(String trace) {
		return trace.isEmpty() ? "" : System.lineSeparator() + trace;
	}
}

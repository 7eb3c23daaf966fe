package org.javai.casebook.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.Fault;
import org.javai.casebook.capture.Check;
import org.javai.casebook.casefile.CaseFileSink;
import org.javai.casebook.classify.Classification;
import org.javai.casebook.classify.MatchTier;
import org.javai.casebook.classify.UnmatchedPolicy;
import org.javai.casebook.guard.FailureGuard;
import org.javai.casebook.rules.RuleRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jDiagnosticReporterTest {

	private static final Fault RAW = Fault.of("vendor", "timeout", "vendor timed out");
	private static final Fault REPORTED = Fault.of("app", "upstream", "upstream unavailable");

	private Logger logger;
	private CapturingAppender appender;
	private Log4jDiagnosticReporter reporter;

	@BeforeEach
	void setUp() {
		logger = (Logger) LogManager.getLogger("org.javai.casebook.test.Log4jDiagnosticReporterTest");
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		logger.setAdditive(false);
		logger.setLevel(Level.ALL);
		reporter = new Log4jDiagnosticReporter(logger);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void reportUnmatched_logsErrorWithMessageAndTrace() {
		FailureRecord record = FailureRecord.of(RAW, "\tat com.example.Shop.pay(Shop.java:7)", true);

		reporter.reportUnmatched(record, new Classification(RAW, RAW, MatchTier.UNMATCHED));

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMarker().getName()).isEqualTo("UNMATCHED");
		assertThat(event.getMessage().getFormattedMessage())
				.contains("vendor timed out")
				.contains("vendor:timeout")
				.contains("Shop.pay");
	}

	@Test
	void reportDispatched_assertionFailure_logsError() {
		FailureRecord record = FailureRecord.of(RAW, "", false);

		reporter.reportDispatched(record, new Classification(RAW, REPORTED, MatchTier.MAPPING));

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMarker().getName()).isEqualTo("FAILURE");
		assertThat(event.getMessage().getFormattedMessage())
				.startsWith("Assertion failed")
				.contains("reported=app:upstream")
				.contains("tier=MAPPING");
	}

	@Test
	void reportDispatched_detectedFailure_logsWarn() {
		FailureRecord record = FailureRecord.of(RAW, "", true);

		reporter.reportDispatched(record, new Classification(RAW, RAW, MatchTier.EXACT));

		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMessage().getFormattedMessage()).startsWith("Failure detected");
	}

	@Test
	void reportDispatched_unmatched_logsNothing() {
		reporter.reportDispatched(FailureRecord.of(RAW, "", true), new Classification(RAW, RAW, MatchTier.UNMATCHED));

		assertThat(appender.events).isEmpty();
	}

	@Test
	void guardRecovery_unmatchedFault_logsMessageOnce() {
		Fault arbitrary = Fault.of("misc", "ex", "something odd");
		FailureGuard guard = FailureGuard.builder(new RuleRegistry())
				.sink(CaseFileSink.noOp())
				.reporter(reporter)
				.unmatchedPolicy(UnmatchedPolicy.PASS_THROUGH)
				.build();

		guard.run(() -> Check.error(arbitrary));

		assertThat(appender.events)
				.filteredOn(event -> event.getMessage().getFormattedMessage().contains("something odd"))
				.singleElement()
				.satisfies(event -> {
					assertThat(event.getLevel()).isEqualTo(Level.ERROR);
					assertThat(event.getMarker().getName()).isEqualTo("UNMATCHED");
				});
	}

	@Test
	void reportUnguarded_logsThreadName() {
		reporter.reportUnguarded(FailureRecord.of(RAW, "", false), new Thread(() -> {}, "worker-3"));

		LogEvent event = appender.events.get(0);
		assertThat(event.getMarker().getName()).isEqualTo("UNGUARDED");
		assertThat(event.getMessage().getFormattedMessage()).contains("worker-3");
	}

	private static class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}

package org.javai.casebook.ops;

import org.javai.casebook.FailureRecord;
import org.javai.casebook.Fault;
import org.javai.casebook.classify.Classification;
import org.javai.casebook.classify.MatchTier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeDiagnosticReporterTest {

	private static final Fault RAW = Fault.of("vendor", "timeout", "vendor timed out");

	private final FailureRecord record = FailureRecord.of(RAW, "", true);
	private final Classification classification = new Classification(RAW, RAW, MatchTier.UNMATCHED);

	@Test
	void fansOutToAllReporters() {
		List<String> calls = new ArrayList<>();
		DiagnosticReporter first = (r, c) -> calls.add("first");
		DiagnosticReporter second = (r, c) -> calls.add("second");

		DiagnosticReporter.composite(first, second).reportUnmatched(record, classification);

		assertThat(calls).containsExactly("first", "second");
	}

	@Test
	void failingReporter_doesNotStopOthers() {
		List<String> calls = new ArrayList<>();
		DiagnosticReporter failing = new DiagnosticReporter() {
			@Override
			public void reportUnmatched(FailureRecord r, Classification c) {
				throw new IllegalStateException("reporter down");
			}

			@Override
			public void reportDispatched(FailureRecord r, Classification c) {
				throw new IllegalStateException("reporter down");
			}
		};
		DiagnosticReporter working = new DiagnosticReporter() {
			@Override
			public void reportUnmatched(FailureRecord r, Classification c) {
				calls.add("unmatched");
			}

			@Override
			public void reportDispatched(FailureRecord r, Classification c) {
				calls.add("dispatched");
			}
		};
		CompositeDiagnosticReporter composite = CompositeDiagnosticReporter.of(List.of(failing, working));

		assertThatCode(() -> {
			composite.reportUnmatched(record, classification);
			composite.reportDispatched(record, classification);
		}).doesNotThrowAnyException();

		assertThat(calls).containsExactly("unmatched", "dispatched");
		assertThat(composite.size()).isEqualTo(2);
	}

	@Test
	void reportUnguarded_reachesEveryReporter() {
		List<String> threads = new ArrayList<>();
		DiagnosticReporter recording = new DiagnosticReporter() {
			@Override
			public void reportUnmatched(FailureRecord r, Classification c) {
			}

			@Override
			public void reportUnguarded(FailureRecord r, Thread thread) {
				threads.add(thread.getName());
			}
		};

		DiagnosticReporter.composite(recording, recording).reportUnguarded(record, new Thread(() -> {}, "t-1"));

		assertThat(threads).containsExactly("t-1", "t-1");
	}

	@Test
	void nullReporter_isRejected() {
		assertThatThrownBy(() -> CompositeDiagnosticReporter.of(DiagnosticReporter.noOp(), null))
				.isInstanceOf(NullPointerException.class);
	}
}

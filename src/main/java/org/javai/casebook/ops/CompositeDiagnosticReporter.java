package org.javai.casebook.ops;

import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A {@link DiagnosticReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and written to stderr, allowing the remaining reporters to run and the
 * recovery to complete.
 *
 * <pre>{@code
 * DiagnosticReporter reporter = CompositeDiagnosticReporter.of(
 *     new Log4jDiagnosticReporter(),
 *     new MetricsDiagnosticReporter("billing")
 * );
 * }</pre>
 */
public final class CompositeDiagnosticReporter implements DiagnosticReporter {

	private final List<DiagnosticReporter> reporters;

	private CompositeDiagnosticReporter(List<DiagnosticReporter> reporters) {
		for (DiagnosticReporter reporter : reporters) {
			Objects.requireNonNull(reporter, "reporters must not contain null");
		}
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite that calls the given reporters in order.
	 *
	 * @param reporters the reporters to fan out to
	 * @return a composite over the given reporters
	 * @throws NullPointerException if any reporter is null
	 */
	public static CompositeDiagnosticReporter of(DiagnosticReporter... reporters) {
		return new CompositeDiagnosticReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite that calls the given reporters in iteration order.
	 *
	 * @param reporters the reporters to fan out to; the collection is copied
	 * @return a composite over the given reporters
	 * @throws NullPointerException if any reporter is null
	 */
	public static CompositeDiagnosticReporter of(Collection<? extends DiagnosticReporter> reporters) {
		return new CompositeDiagnosticReporter(new ArrayList<>(reporters));
	}

	@Override
	public void reportUnmatched(FailureRecord record, Classification classification) {
		fanOut("reportUnmatched", reporter -> reporter.reportUnmatched(record, classification));
	}

	@Override
	public void reportDispatched(FailureRecord record, Classification classification) {
		fanOut("reportDispatched", reporter -> reporter.reportDispatched(record, classification));
	}

	@Override
	public void reportUnguarded(FailureRecord record, Thread thread) {
		fanOut("reportUnguarded", reporter -> reporter.reportUnguarded(record, thread));
	}

	/**
	 * Returns the number of reporters this composite calls, counting repeats.
	 */
	public int size() {
		return reporters.size();
	}

	// A failing reporter must not keep the failure from the others, nor abort the recovery.
	private void fanOut(String method, Consumer<DiagnosticReporter> call) {
		for (DiagnosticReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				System.err.println("DiagnosticReporter." + method + " failed for "
					+ reporter.getClass().getName() + ": " + e.getMessage());
			}
		}
	}
}

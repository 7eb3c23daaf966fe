package org.javai.casebook.ops;

import org.javai.casebook.FailureRecord;
import org.javai.casebook.classify.Classification;

/**
 * Receives diagnostics from classification and recovery.
 * Implementations might write structured logs or emit metrics.
 */
public interface DiagnosticReporter {

    /**
     * Reports a fault that reached the classifier with no matching rule and no fallback.
     * Called once per such classification.
     *
     * @param record The failure, including its message and captured trace
     * @param classification The unmatched classification
     */
    void reportUnmatched(FailureRecord record, Classification classification);

    /**
     * Reports a failure recovered by a guard, after its case file was written.
     */
    default void reportDispatched(FailureRecord record, Classification classification) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a failure signal that escaped every guard.
     */
    default void reportUnguarded(FailureRecord record, Thread thread) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static DiagnosticReporter noOp() {
        return (record, classification) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static DiagnosticReporter composite(DiagnosticReporter... reporters) {
        return CompositeDiagnosticReporter.of(reporters);
    }
}

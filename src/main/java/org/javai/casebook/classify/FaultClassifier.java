package org.javai.casebook.classify;

import org.javai.casebook.FailureRecord;
import org.javai.casebook.Fault;

/**
 * Maps raw faults to the faults that get reported.
 * Implementations should be deterministic for a fixed set of rules.
 */
@FunctionalInterface
public interface FaultClassifier {

    /**
     * Classifies a captured failure. The record's trace is available to diagnostics.
     *
     * @param record The failure captured at the failing check
     * @return The classification of the record's fault
     */
    Classification classify(FailureRecord record);

    /**
     * Classifies a bare fault with no captured trace.
     */
    default Classification classify(Fault fault) {
        return classify(FailureRecord.of(fault, "", true));
    }
}

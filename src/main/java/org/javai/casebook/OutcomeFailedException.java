package org.javai.casebook;

import java.util.Optional;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first or used pattern matching.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Fault fault;
    private final FailureRecord record;

    public OutcomeFailedException(Fault fault, FailureRecord record) {
        super("Outcome failed: " + fault.message());
        this.fault = fault;
        this.record = record;
    }

    public Fault fault() {
        return fault;
    }

    public Optional<FailureRecord> record() {
        return Optional.ofNullable(record);
    }
}

package org.javai.casebook;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything captured at the moment a check failed.
 *
 * @param fault The raw fault, before classification
 * @param trace The stack trace text taken at the failure point
 * @param detected {@code true} if a delegated operation reported the fault,
 *                 {@code false} if an asserted condition was violated
 * @param occurredAt When the check failed
 * @param threadName The thread the check failed on
 */
public record FailureRecord(
        Fault fault,
        String trace,
        boolean detected,
        Instant occurredAt,
        String threadName
) {

    public FailureRecord {
        Objects.requireNonNull(fault, "fault must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        trace = trace == null ? "" : trace;
        threadName = threadName == null ? "" : threadName;
    }

    /**
     * Creates a record stamped with the current time and thread.
     */
    public static FailureRecord of(Fault fault, String trace, boolean detected) {
        return new FailureRecord(fault, trace, detected, Instant.now(), Thread.currentThread().getName());
    }

    public String message() {
        return fault.message();
    }
}

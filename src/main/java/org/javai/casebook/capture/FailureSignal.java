package org.javai.casebook.capture;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.Fault;

/**
 * Carries a {@link FailureRecord} from a failed check to the nearest
 * {@link org.javai.casebook.guard.FailureGuard}.
 *
 * <p>The signal is an unchecked exception so that it passes through every intermediate
 * frame without those frames checking for it. Only guards catch it; application code
 * should not. The record's trace is taken when the signal is constructed, so it shows
 * the stack of the failing check rather than that of the guard.
 */
public final class FailureSignal extends RuntimeException {

    private static final Set<String> CAPTURE_FRAMES = Set.of(
            Check.class.getName(),
            FailureSignal.class.getName());

    private final FailureRecord record;

    FailureSignal(Fault fault, boolean detected) {
        super(Objects.requireNonNull(fault, "fault must not be null").message(), fault.cause().orElse(null));
        setStackTrace(callSiteFrames(getStackTrace()));
        this.record = new FailureRecord(
                fault,
                renderTrace(this, fault),
                detected,
                Instant.now(),
                Thread.currentThread().getName());
    }

    public FailureRecord record() {
        return record;
    }

    private static StackTraceElement[] callSiteFrames(StackTraceElement[] frames) {
        int start = 0;
        while (start < frames.length && CAPTURE_FRAMES.contains(frames[start].getClassName())) {
            start++;
        }
        return Arrays.copyOfRange(frames, start, frames.length);
    }

    private static String renderTrace(FailureSignal signal, Fault fault) {
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement frame : signal.getStackTrace()) {
            sb.append("\tat ").append(frame).append(System.lineSeparator());
        }
        fault.cause().ifPresent(cause -> {
            StringWriter causeTrace = new StringWriter();
            cause.printStackTrace(new PrintWriter(causeTrace));
            sb.append("Caused by: ").append(causeTrace);
        });
        return sb.toString().stripTrailing();
    }
}

package org.javai.casebook;

import java.util.Objects;
import java.util.Optional;

/**
 * An error identity: a code, a human-readable message and, for faults built from
 * exceptions, the underlying cause.
 *
 * <p>Faults compare by <em>reference</em>. Two faults are the same error only if they
 * are the same instance, so applications declare their faults once, typically as
 * constants, and register those instances with a
 * {@link org.javai.casebook.rules.RuleRegistry}. Message text only matters to
 * pattern rules.
 *
 * <pre>{@code
 * public static final Fault DISK_FULL = Fault.of("storage", "disk_full", "disk: no space left");
 * }</pre>
 */
public final class Fault {

    /**
     * Raised when the capture API is used incorrectly. Never reclassified.
     */
    public static final Fault IMPROPER_USE = new Fault(
            FailureCode.of("casebook", "improper_use"),
            "improper use of failure capture",
            null);

    /**
     * Reported for faults that no rule matched when the classifier runs with
     * {@link org.javai.casebook.classify.UnmatchedPolicy#UNEXPECTED}.
     */
    public static final Fault UNEXPECTED = new Fault(
            FailureCode.of("casebook", "unexpected"),
            "unexpected failure",
            null);

    private final FailureCode code;
    private final String message;
    private final Throwable cause;

    private Fault(FailureCode code, String message, Throwable cause) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.cause = cause;
    }

    public static Fault of(FailureCode code, String message) {
        return new Fault(code, message, null);
    }

    public static Fault of(String namespace, String name, String message) {
        return new Fault(FailureCode.of(namespace, name), message, null);
    }

    /**
     * Creates a fault whose namespace is the package of the declaring class.
     */
    public static Fault of(Class<?> owner, String name, String message) {
        return new Fault(FailureCode.of(owner, name), message, null);
    }

    /**
     * Wraps an exception thrown by a delegated operation into a fresh fault.
     *
     * <p>The result is a new identity on every call, so only pattern rules and the
     * fallback can match it. The code is {@code exception:<SimpleName>}, or the binary
     * class name for an anonymous exception class.
     */
    public static Fault fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return new Fault(FailureCode.of("exception", exceptionName(t.getClass())), message, t);
    }

    // Anonymous and hidden classes have no simple name.
    private static String exceptionName(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    public FailureCode code() {
        return code;
    }

    public String message() {
        return message;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return code + " (" + message + ")";
    }
}

package org.javai.casebook.capture;

import org.javai.casebook.Fault;
import org.javai.casebook.Outcome;

/**
 * Failure capture for guarded code.
 *
 * <p>Each method either returns normally or throws a {@link FailureSignal} that unwinds
 * straight to the enclosing {@link org.javai.casebook.guard.FailureGuard}:
 * <pre>{@code
 * guard.run(() -> {
 *     Check.that(order.total() > 0, EMPTY_ORDER);
 *     Receipt receipt = Check.call(() -> payments.charge(order));
 *     Check.error(ledger.record(receipt));
 * });
 * }</pre>
 *
 * <p>Assertions ({@link #that}) produce records with {@code detected == false}; failures
 * reported by delegated operations produce {@code detected == true}.
 */
public final class Check {

    private Check() {
        // Utility class
    }

    /**
     * Signals {@code fault} if the condition does not hold.
     * A null fault signals {@link Fault#IMPROPER_USE} instead.
     */
    public static void that(boolean condition, Fault fault) {
        if (condition) {
            return;
        }
        throw new FailureSignal(fault != null ? fault : Fault.IMPROPER_USE, false);
    }

    /**
     * Signals the error returned by a delegated operation; does nothing when it is null.
     */
    public static void error(Fault errorOrNull) {
        if (errorOrNull != null) {
            throw new FailureSignal(errorOrNull, true);
        }
    }

    /**
     * Runs a delegated operation, signalling a checked exception it throws as a fault.
     *
     * <p>Runtime exceptions are not failures of the operation but defects, and propagate
     * unchanged.
     *
     * @return the operation's result
     */
    public static <T> T call(ThrowingSupplier<T, ? extends Exception> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new FailureSignal(Fault.fromThrowable(e), true);
        }
    }

    /**
     * Unwraps a successful outcome, or signals the fault of a failed one.
     */
    public static <T> T outcome(Outcome<T> outcome) {
        if (outcome instanceof Outcome.Fail<T> fail) {
            throw new FailureSignal(fail.classified(), true);
        }
        return outcome.getOrThrow();
    }

    /**
     * Inspects the last of a delegated operation's return values.
     *
     * <p>For call sites that receive results as untyped values. A null last value is
     * success. A {@link Fault} or {@link Throwable} is signalled as detected. Anything
     * else, or no values at all, is a misuse and signals {@link Fault#IMPROPER_USE}.
     */
    public static void returned(Object... values) {
        if (values == null) {
            return;
        }
        if (values.length == 0) {
            throw new FailureSignal(Fault.IMPROPER_USE, false);
        }
        Object last = values[values.length - 1];
        if (last == null) {
            return;
        }
        if (last instanceof Fault fault) {
            throw new FailureSignal(fault, true);
        }
        if (last instanceof Throwable t) {
            throw new FailureSignal(Fault.fromThrowable(t), true);
        }
        throw new FailureSignal(Fault.IMPROPER_USE, false);
    }
}

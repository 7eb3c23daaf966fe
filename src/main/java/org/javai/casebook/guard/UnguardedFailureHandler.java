package org.javai.casebook.guard;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.casebook.capture.FailureSignal;
import org.javai.casebook.ops.DiagnosticReporter;

/**
 * Catches failure signals that reached the top of a thread without passing a guard.
 *
 * <p>A signal escaping every guard means a call chain ran checks without establishing a
 * {@link FailureGuard} first. This handler reports the misuse and recovers the failure
 * through a fallback guard, so the case file is still written. Any other uncaught
 * exception goes to the delegate handler unchanged, or is printed to stderr as the JVM
 * would when there is none.
 *
 * <pre>{@code
 * UnguardedFailureHandler handler = new UnguardedFailureHandler(fallbackGuard, reporter);
 * ExecutorService executor = Executors.newFixedThreadPool(4, handler.threadFactory("worker"));
 * }</pre>
 */
public final class UnguardedFailureHandler implements UncaughtExceptionHandler {

    private final FailureGuard fallbackGuard;
    private final DiagnosticReporter reporter;
    private final UncaughtExceptionHandler delegate;

    public UnguardedFailureHandler(FailureGuard fallbackGuard, DiagnosticReporter reporter) {
        this(fallbackGuard, reporter, null);
    }

    /**
     * @param delegate receives every throwable that is not a failure signal; may be null
     */
    public UnguardedFailureHandler(
            FailureGuard fallbackGuard,
            DiagnosticReporter reporter,
            UncaughtExceptionHandler delegate
    ) {
        this.fallbackGuard = Objects.requireNonNull(fallbackGuard, "fallbackGuard must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.delegate = delegate;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        if (throwable instanceof FailureSignal signal) {
            reporter.reportUnguarded(signal.record(), thread);
            fallbackGuard.recover(signal.record());
            return;
        }
        if (delegate != null) {
            delegate.uncaughtException(thread, throwable);
            return;
        }
        System.err.print("Exception in thread \"" + thread.getName() + "\" ");
        throwable.printStackTrace(System.err);
    }

    /**
     * Installs this handler as the default for all threads.
     */
    public void installAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a ThreadFactory that installs this handler on all created threads.
     */
    public ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setUncaughtExceptionHandler(this);
            return thread;
        };
    }

    /**
     * Creates a named ThreadFactory that installs this handler on all created threads.
     */
    public ThreadFactory threadFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setUncaughtExceptionHandler(UnguardedFailureHandler.this);
                return thread;
            }
        };
    }
}

package org.javai.casebook.guard;

import java.nio.file.Path;
import java.util.Objects;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.Outcome;
import org.javai.casebook.capture.FailureSignal;
import org.javai.casebook.capture.ThrowingSupplier;
import org.javai.casebook.casefile.CaseFileSink;
import org.javai.casebook.casefile.FileCaseFileSink;
import org.javai.casebook.classify.Classification;
import org.javai.casebook.classify.FaultClassifier;
import org.javai.casebook.classify.RuleBasedClassifier;
import org.javai.casebook.classify.UnmatchedPolicy;
import org.javai.casebook.ops.DiagnosticReporter;
import org.javai.casebook.ops.log4j.Log4jDiagnosticReporter;
import org.javai.casebook.rules.RuleRegistry;

/**
 * The recovery point for failures signalled by {@link org.javai.casebook.capture.Check}.
 *
 * <p>A guard wraps the outermost frame of a call chain. When a check fails anywhere below
 * it, control comes straight back to the guard, which:
 * <ol>
 *   <li>classifies the raw fault,</li>
 *   <li>writes a case file through its {@link CaseFileSink},</li>
 *   <li>reports the recovery to its {@link DiagnosticReporter},</li>
 *   <li>invokes its {@link FailureAction}, if one is configured.</li>
 * </ol>
 *
 * <p>Only {@link FailureSignal}s are recovered. Every other exception leaves the guard
 * unchanged, and so does a {@link org.javai.casebook.casefile.CaseFileException} raised
 * while writing the case file.
 *
 * <pre>{@code
 * FailureGuard guard = FailureGuard.builder(rules)
 *     .notebook(Path.of("/var/log/orders.case"))
 *     .action((detected, fault) -> metrics.count(fault.code()))
 *     .build();
 *
 * guard.run(() -> processOrder(order));
 *
 * // Or, at a function boundary that returns its errors:
 * Outcome<Receipt> receipt = guard.call(() -> checkout(cart));
 * }</pre>
 */
public final class FailureGuard {

    private final FaultClassifier classifier;
    private final CaseFileSink sink;
    private final DiagnosticReporter reporter;
    private final FailureAction action;

    private FailureGuard(Builder builder) {
        this.reporter = builder.reporter != null ? builder.reporter : new Log4jDiagnosticReporter();
        this.classifier = builder.classifier != null
                ? builder.classifier
                : new RuleBasedClassifier(
                        builder.registry,
                        builder.unmatchedPolicy != null ? builder.unmatchedPolicy : UnmatchedPolicy.fromConfig(),
                        reporter);
        this.sink = builder.sink != null ? builder.sink : new FileCaseFileSink();
        this.action = builder.action;
    }

    /**
     * Starts a guard that classifies with a {@link RuleBasedClassifier} over the given rules.
     */
    public static Builder builder(RuleRegistry registry) {
        return new Builder(Objects.requireNonNull(registry, "registry must not be null"), null);
    }

    /**
     * Starts a guard that uses a custom classifier.
     */
    public static Builder builder(FaultClassifier classifier) {
        return new Builder(null, Objects.requireNonNull(classifier, "classifier must not be null"));
    }

    /**
     * Runs work, recovering any failure signalled inside it and delivering it to the
     * configured {@link FailureAction}.
     */
    public void run(Runnable work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            work.run();
        } catch (FailureSignal signal) {
            recover(signal.record());
        }
    }

    /**
     * Runs work and turns a recovered failure into a returned {@link Outcome.Fail}
     * holding the classified fault. The {@link FailureAction} is not invoked.
     *
     * @throws E if the work throws it; checked exceptions are not recovered
     */
    public <T, E extends Exception> Outcome<T> call(ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return Outcome.ok(work.get());
        } catch (FailureSignal signal) {
            FailureRecord record = signal.record();
            Classification classification = dispatch(record);
            return Outcome.fail(classification.result(), record);
        }
    }

    /**
     * Classifies a record, writes its case file and reports it, then invokes the
     * {@link FailureAction}.
     */
    public Classification recover(FailureRecord record) {
        Classification classification = dispatch(record);
        if (action != null) {
            action.onFailure(record.detected(), classification.result());
        }
        return classification;
    }

    /**
     * Classifies a record, writes its case file and reports it.
     *
     * @throws org.javai.casebook.casefile.CaseFileException if the case file cannot be written
     */
    public Classification dispatch(FailureRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Classification classification = classifier.classify(record);
        sink.write(record, classification);
        reporter.reportDispatched(record, classification);
        return classification;
    }

    public FaultClassifier classifier() {
        return classifier;
    }

    public static final class Builder {
        private final RuleRegistry registry;
        private final FaultClassifier classifier;
        private CaseFileSink sink;
        private DiagnosticReporter reporter;
        private UnmatchedPolicy unmatchedPolicy;
        private FailureAction action;

        private Builder(RuleRegistry registry, FaultClassifier classifier) {
            this.registry = registry;
            this.classifier = classifier;
        }

        /**
         * Writes case files to the given path, falling back to temporary files.
         */
        public Builder notebook(Path path) {
            this.sink = new FileCaseFileSink(Objects.requireNonNull(path, "path must not be null"));
            return this;
        }

        public Builder sink(CaseFileSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            return this;
        }

        public Builder reporter(DiagnosticReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Only applies to guards built from a {@link RuleRegistry}.
         */
        public Builder unmatchedPolicy(UnmatchedPolicy unmatchedPolicy) {
            this.unmatchedPolicy = Objects.requireNonNull(unmatchedPolicy, "unmatchedPolicy must not be null");
            return this;
        }

        public Builder action(FailureAction action) {
            this.action = Objects.requireNonNull(action, "action must not be null");
            return this;
        }

        public FailureGuard build() {
            return new FailureGuard(this);
        }
    }
}

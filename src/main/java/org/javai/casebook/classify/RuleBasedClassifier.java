package org.javai.casebook.classify;

import java.util.Objects;
import java.util.Optional;
import org.javai.casebook.FailureRecord;
import org.javai.casebook.Fault;
import org.javai.casebook.ops.DiagnosticReporter;
import org.javai.casebook.ops.log4j.Log4jDiagnosticReporter;
import org.javai.casebook.rules.RuleRegistry;

/**
 * Classifies faults against a {@link RuleRegistry}.
 *
 * <p>Rules are consulted in a fixed order and the first match wins:
 * <ol>
 *   <li>{@link MatchTier#EXACT}: the fault is registered as exact, and is reported as is.
 *       {@link Fault#IMPROPER_USE} is always treated as exact.</li>
 *   <li>{@link MatchTier#MAPPING}: the fault has a direct mapping.</li>
 *   <li>{@link MatchTier#PATTERN}: a message rule matches the fault's message. When two
 *       rules match, the one registered first wins.</li>
 *   <li>{@link MatchTier#FALLBACK}: the registry has a fallback.</li>
 *   <li>{@link MatchTier#UNMATCHED}: the fault, or {@link Fault#UNEXPECTED}, depending on the
 *       {@link UnmatchedPolicy}. Every unmatched classification is reported once to the
 *       {@link DiagnosticReporter}.</li>
 * </ol>
 *
 * <p>Explicit registrations therefore always beat message rules, and the fallback only
 * applies when nothing else does.
 */
public final class RuleBasedClassifier implements FaultClassifier {

    private final RuleRegistry registry;
    private final UnmatchedPolicy unmatchedPolicy;
    private final DiagnosticReporter reporter;

    public RuleBasedClassifier(RuleRegistry registry) {
        this(registry, UnmatchedPolicy.PASS_THROUGH, new Log4jDiagnosticReporter());
    }

    public RuleBasedClassifier(RuleRegistry registry, UnmatchedPolicy unmatchedPolicy, DiagnosticReporter reporter) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.unmatchedPolicy = Objects.requireNonNull(unmatchedPolicy, "unmatchedPolicy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * A classifier with no rules that reports every fault as {@link Fault#UNEXPECTED}.
     */
    public static RuleBasedClassifier unconfigured() {
        return new RuleBasedClassifier(new RuleRegistry(), UnmatchedPolicy.UNEXPECTED, new Log4jDiagnosticReporter());
    }

    public RuleRegistry registry() {
        return registry;
    }

    public UnmatchedPolicy unmatchedPolicy() {
        return unmatchedPolicy;
    }

    @Override
    public Classification classify(FailureRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Fault fault = record.fault();

        if (fault == Fault.IMPROPER_USE || registry.isExact(fault)) {
            return new Classification(fault, fault, MatchTier.EXACT);
        }

        Optional<Fault> mapped = registry.mappingFor(fault);
        if (mapped.isPresent()) {
            return new Classification(fault, mapped.get(), MatchTier.MAPPING);
        }

        Optional<Fault> matched = registry.matchPattern(fault.message());
        if (matched.isPresent()) {
            return new Classification(fault, matched.get(), MatchTier.PATTERN);
        }

        Optional<Fault> fallback = registry.fallback();
        if (fallback.isPresent()) {
            return new Classification(fault, fallback.get(), MatchTier.FALLBACK);
        }

        return unmatched(record);
    }

    private Classification unmatched(FailureRecord record) {
        Fault result = switch (unmatchedPolicy) {
            case PASS_THROUGH -> record.fault();
            case UNEXPECTED -> Fault.UNEXPECTED;
        };
        Classification classification = new Classification(record.fault(), result, MatchTier.UNMATCHED);
        reporter.reportUnmatched(record, classification);
        return classification;
    }
}

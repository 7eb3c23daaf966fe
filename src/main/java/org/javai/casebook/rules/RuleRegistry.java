package org.javai.casebook.rules;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.javai.casebook.Fault;

/**
 * The classification rules of one scope.
 *
 * <p>Holds four kinds of rule, consulted by
 * {@link org.javai.casebook.classify.RuleBasedClassifier} in this order:
 * <ol>
 *   <li>exact faults, passed through unchanged</li>
 *   <li>direct mappings from one fault to another</li>
 *   <li>message rules, tested in registration order</li>
 *   <li>an optional fallback</li>
 * </ol>
 *
 * <p>Exact faults and mapping keys are compared by identity. Registering the same key
 * twice replaces the earlier value; a replaced message rule keeps its original
 * position.
 *
 * <p>Registration is expected to happen at startup, before traffic arrives. Reads and
 * writes are nevertheless serialized by a read-write lock, so a late registration
 * never corrupts a concurrent lookup.
 */
public final class RuleRegistry {

    private record PatternEntry(MessageRule rule, Fault target) {}

    private final PatternSyntax patternSyntax;
    private final Set<Fault> exact = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Fault, Fault> mappings = new IdentityHashMap<>();
    private final Map<String, PatternEntry> patterns = new LinkedHashMap<>();
    private Fault fallback;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates a registry whose {@link #registerPattern(String, Fault)} treats text as a prefix.
     */
    public RuleRegistry() {
        this(PatternSyntax.PREFIX);
    }

    public RuleRegistry(PatternSyntax patternSyntax) {
        this.patternSyntax = Objects.requireNonNull(patternSyntax, "patternSyntax must not be null");
    }

    public PatternSyntax patternSyntax() {
        return patternSyntax;
    }

    // Registration

    public RuleRegistry registerExact(Fault fault) {
        Objects.requireNonNull(fault, "fault must not be null");
        lock.writeLock().lock();
        try {
            exact.add(fault);
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    public RuleRegistry registerMapping(Fault from, Fault to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        lock.writeLock().lock();
        try {
            mappings.put(from, to);
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /**
     * Registers a message rule using this registry's {@link PatternSyntax}.
     *
     * @throws IllegalArgumentException if the syntax is {@code REGEX} and the text does not compile
     */
    public RuleRegistry registerPattern(String pattern, Fault target) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return registerRule(patternSyntax.compile(pattern), target);
    }

    public RuleRegistry registerPrefix(String prefix, Fault target) {
        return registerRule(MessageRule.prefix(prefix), target);
    }

    public RuleRegistry registerRegex(String expression, Fault target) {
        return registerRule(MessageRule.regex(expression), target);
    }

    public RuleRegistry registerRule(MessageRule rule, Fault target) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(target, "target must not be null");
        lock.writeLock().lock();
        try {
            patterns.put(rule.text(), new PatternEntry(rule, target));
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    public RuleRegistry setFallback(Fault fault) {
        Objects.requireNonNull(fault, "fault must not be null, use clearFallback()");
        lock.writeLock().lock();
        try {
            fallback = fault;
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    public RuleRegistry clearFallback() {
        lock.writeLock().lock();
        try {
            fallback = null;
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    // Lookup

    public boolean isExact(Fault fault) {
        lock.readLock().lock();
        try {
            return exact.contains(fault);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Fault> mappingFor(Fault fault) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(mappings.get(fault));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the target of the first registered message rule matching the text.
     */
    public Optional<Fault> matchPattern(String message) {
        Objects.requireNonNull(message, "message must not be null");
        lock.readLock().lock();
        try {
            for (PatternEntry entry : patterns.values()) {
                if (entry.rule().matches(message)) {
                    return Optional.of(entry.target());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Fault> fallback() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(fallback);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Total number of exact, mapping and message rules. The fallback is not counted.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return exact.size() + mappings.size() + patterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "RuleRegistry[exact=" + exact.size()
                    + ", mappings=" + mappings.size()
                    + ", patterns=" + patterns.keySet()
                    + ", fallback=" + (fallback != null ? fallback.code() : "none") + "]";
        } finally {
            lock.readLock().unlock();
        }
    }
}

package org.javai.casebook.rules;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A table of {@link RuleRegistry} instances keyed by the code that uses them.
 *
 * <p>Independent components get independent rules without passing registry objects
 * through every call: each package resolves its own registry, and repeated
 * resolution from the same package returns the same instance.
 *
 * <pre>{@code
 * RuleRegistry rules = RegistryScopes.global().forCaller();
 * rules.registerMapping(VENDOR_TIMEOUT, UPSTREAM_UNAVAILABLE);
 * }</pre>
 *
 * <p>Code that prefers explicit wiring can construct a {@link RuleRegistry} directly
 * and hand it to the guard; this table is a convenience, not a requirement.
 */
public final class RegistryScopes {

    private static final RegistryScopes GLOBAL = new RegistryScopes();

    private static final StackWalker WALKER =
            StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private final Map<ScopeKey, RuleRegistry> registries = new ConcurrentHashMap<>();
    private final PatternSyntax patternSyntax;

    public RegistryScopes() {
        this(PatternSyntax.PREFIX);
    }

    /**
     * @param patternSyntax the syntax given to every registry this table creates
     */
    public RegistryScopes(PatternSyntax patternSyntax) {
        this.patternSyntax = Objects.requireNonNull(patternSyntax, "patternSyntax must not be null");
    }

    /**
     * The process-wide table. Entries live as long as the process.
     */
    public static RegistryScopes global() {
        return GLOBAL;
    }

    public RuleRegistry forKey(ScopeKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return registries.computeIfAbsent(key, k -> new RuleRegistry(patternSyntax));
    }

    public RuleRegistry forClass(Class<?> type) {
        return forKey(ScopeKey.of(type));
    }

    /**
     * Resolves the registry of the class that calls this method.
     */
    public RuleRegistry forCaller() {
        return forClass(WALKER.getCallerClass());
    }

    public Set<ScopeKey> scopes() {
        return Set.copyOf(registries.keySet());
    }
}

package org.javai.casebook.classify;

/**
 * Which rule decided a classification, in precedence order.
 */
public enum MatchTier {
    /**
     * The fault is registered to pass through unchanged.
     */
    EXACT,

    /**
     * A direct mapping replaced the fault.
     */
    MAPPING,

    /**
     * A message rule matched the fault's text.
     */
    PATTERN,

    /**
     * Nothing matched and the registry's fallback was used.
     */
    FALLBACK,

    /**
     * Nothing matched and no fallback is configured. Always reported as a diagnostic.
     */
    UNMATCHED
}

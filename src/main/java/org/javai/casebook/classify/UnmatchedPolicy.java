package org.javai.casebook.classify;

import java.util.Locale;
import org.javai.casebook.CasebookConfig;

/**
 * What a classifier reports when no rule matches and no fallback is configured.
 */
public enum UnmatchedPolicy {
    /**
     * Report the raw fault unchanged.
     */
    PASS_THROUGH,

    /**
     * Report {@link org.javai.casebook.Fault#UNEXPECTED}.
     */
    UNEXPECTED;

    /**
     * Reads the policy from {@code casebook.unmatched} / {@code CASEBOOK_UNMATCHED},
     * defaulting to {@link #PASS_THROUGH}.
     *
     * @throws IllegalStateException if the configured value names no policy
     */
    public static UnmatchedPolicy fromConfig() {
        return CasebookConfig.unmatchedPolicy()
                .map(UnmatchedPolicy::parse)
                .orElse(PASS_THROUGH);
    }

    static UnmatchedPolicy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown unmatched policy '" + value
                    + "', expected PASS_THROUGH or UNEXPECTED", e);
        }
    }
}

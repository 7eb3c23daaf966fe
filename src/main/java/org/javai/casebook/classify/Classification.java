package org.javai.casebook.classify;

import java.util.Objects;
import org.javai.casebook.Fault;

/**
 * The result of classifying a fault.
 *
 * @param original The raw fault
 * @param result The fault to report
 * @param tier The rule tier that produced the result
 */
public record Classification(Fault original, Fault result, MatchTier tier) {

    public Classification {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
    }

    /**
     * Whether the reported fault is the raw fault itself.
     */
    public boolean unchanged() {
        return original == result;
    }
}

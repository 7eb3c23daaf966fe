package org.javai.casebook.guard;

import org.javai.casebook.Fault;

/**
 * Invoked by a {@link FailureGuard} after it has recovered and classified a failure.
 */
@FunctionalInterface
public interface FailureAction {

    /**
     * @param detected {@code true} if a delegated operation reported the failure,
     *                 {@code false} if an assertion was violated
     * @param fault the classified fault
     */
    void onFailure(boolean detected, Fault fault);
}

package com.example.tiltbatch;

import java.util.Optional;

/**
 * What happened to one stage during a run.
 *
 * @param stage     stage name
 * @param scope     scope the stage was reconciled against
 * @param reconcile reconciliation result
 * @param dispatch  dispatch summary, empty when the stage was skipped
 */
public record StageOutcome(
        String stage,
        ScopeSpecification scope,
        ReconcileResult reconcile,
        Optional<DispatchReport> dispatch
) {
    public boolean skipped() {
        return dispatch.isEmpty();
    }
}

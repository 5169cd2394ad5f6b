package com.governance.engine.policy;

import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.model.policy.PolicyDecision;

/**
 * Decision plus what happened when it was written to the audit trail.
 *
 * @param record the stored audit row; on {@link Outcome#DUPLICATE} the row that won, when known
 */
public record GateResult(
    Outcome outcome,
    PolicyDecision decision,
    ExecutionRecord record
) {
    public enum Outcome {
        /** This call wrote the audit row. */
        RECORDED,
        /** Another writer already holds this request or admission slot: already processed or pending. */
        DUPLICATE
    }

    /**
     * Whether the caller may perform the action.
     */
    public boolean mayProceed() {
        return outcome == Outcome.RECORDED && decision.allow();
    }

    public boolean isDuplicate() {
        return outcome == Outcome.DUPLICATE;
    }
}

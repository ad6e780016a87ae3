package com.platform.clonegovernance.guard;

import com.platform.clonegovernance.audit.RecordingResult;
import com.platform.clonegovernance.evaluation.PolicyVerdict;

/**
 * Outcome of a guarded clone creation.
 *
 * @param value     whatever the creation callback returned, null when blocked
 * @param recording result of writing the audit record
 */
public record GovernedOperationResult<T>(
    Outcome outcome,
    T value,
    PolicyVerdict verdict,
    RecordingResult recording
) {

    public enum Outcome {
        COMPLETED,
        BLOCKED
    }

    static <T> GovernedOperationResult<T> completed(T value, PolicyVerdict verdict, RecordingResult recording) {
        return new GovernedOperationResult<>(Outcome.COMPLETED, value, verdict, recording);
    }

    static <T> GovernedOperationResult<T> blocked(PolicyVerdict verdict, RecordingResult recording) {
        return new GovernedOperationResult<>(Outcome.BLOCKED, null, verdict, recording);
    }

    public boolean isBlocked() {
        return outcome == Outcome.BLOCKED;
    }
}

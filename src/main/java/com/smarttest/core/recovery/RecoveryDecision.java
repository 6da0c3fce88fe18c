package com.smarttest.core.recovery;

import com.smarttest.core.model.RunState;

import java.time.Duration;

/**
 * What to do about a step failure.
 *
 * @param action      retry, rollback, skip or abort
 * @param delay       wait before retrying; null unless {@code action == RETRY}
 * @param reason      human-readable explanation
 * @param category    classification of the failure
 * @param targetState rollback target of the failing state, for diagnostics; may be null
 */
public record RecoveryDecision(
    RecoveryAction action,
    Duration delay,
    String reason,
    ErrorCategory category,
    RunState targetState
) {

    public static RecoveryDecision retry(Duration delay, String reason, ErrorCategory category) {
        return new RecoveryDecision(RecoveryAction.RETRY, delay, reason, category, null);
    }

    public static RecoveryDecision abort(String reason, ErrorCategory category, RunState rollbackTarget) {
        return new RecoveryDecision(RecoveryAction.ABORT, null, reason, category, rollbackTarget);
    }

    public boolean isRetry() {
        return action == RecoveryAction.RETRY;
    }
}

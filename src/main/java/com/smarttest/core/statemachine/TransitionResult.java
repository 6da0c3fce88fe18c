package com.smarttest.core.statemachine;

import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.RunState;

/**
 * Outcome of asking the state machine to apply an event.
 *
 * @param success  whether the event was accepted
 * @param newState resulting state (the current state when rejected)
 * @param isNoOp   accepted, but nothing changes and nothing is logged
 * @param logEntry entry to append; present only for applied, non-no-op transitions
 * @param error    why the event was rejected
 * @param key      idempotency key to record once the applied transition is persisted
 */
public record TransitionResult(
    boolean success,
    RunState newState,
    boolean isNoOp,
    DecisionLogEntry logEntry,
    String error,
    IdempotencyKey key
) {

    static TransitionResult applied(IdempotencyKey key, DecisionLogEntry entry) {
        return new TransitionResult(true, entry.toState(), false, entry, null, key);
    }

    static TransitionResult noOp(RunState state) {
        return new TransitionResult(true, state, true, null, null, null);
    }

    static TransitionResult rejected(RunState current, String error) {
        return new TransitionResult(false, current, false, null, error, null);
    }
}

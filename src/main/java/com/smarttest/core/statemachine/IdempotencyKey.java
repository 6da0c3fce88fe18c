package com.smarttest.core.statemachine;

import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;

/**
 * Identifies one application of an event to a run in a given state.
 */
public record IdempotencyKey(
    String runId,
    RunState fromState,
    RunEvent event,
    String shardId
) {

    @Override
    public String toString() {
        String base = runId + ":" + fromState.wireName() + ":" + event;
        return shardId == null ? base : base + ":" + shardId;
    }
}

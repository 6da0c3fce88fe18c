package com.smarttest.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable line of a run's audit trail.
 *
 * @param timestamp when the transition was applied
 * @param fromState state the run left
 * @param toState   state the run entered
 * @param event     event that caused the transition
 * @param reason    optional free-text reason (reviewer comments, error message)
 * @param metadata  optional structured context (reviewer id, error type, ...); null values are dropped
 */
public record DecisionLogEntry(
    Instant timestamp,
    RunState fromState,
    RunState toState,
    RunEvent event,
    String reason,
    Map<String, Object> metadata
) implements Serializable {

    public DecisionLogEntry {
        metadata = withoutNullValues(metadata);
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, Object>();
        metadata.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy stamped with {@code newTimestamp}.
     */
    public DecisionLogEntry withTimestamp(Instant newTimestamp) {
        return new DecisionLogEntry(newTimestamp, fromState, toState, event, reason, metadata);
    }
}

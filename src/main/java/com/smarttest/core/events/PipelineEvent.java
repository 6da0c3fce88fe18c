package com.smarttest.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run moves through the pipeline.
 *
 * @param type      event type
 * @param runId     the run this event belongs to
 * @param data      event-specific payload (states, step name, error message, ...)
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    PipelineEventType type,
    String runId,
    Map<String, Object> data,
    Instant timestamp
) implements Serializable {

    public PipelineEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}

package com.smarttest.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineEventType {
    STEP_STARTED("step_started"),
    STEP_COMPLETED("step_completed"),
    STEP_FAILED("step_failed"),
    APPROVAL_REQUIRED("approval_required"),
    CONFIRMATION_REQUIRED("confirmation_required"),
    STATE_TRANSITION("state_transition"),
    PIPELINE_COMPLETED("pipeline:completed"),
    PIPELINE_ERROR("pipeline:error");

    private final String wireName;

    PipelineEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Whether this is the last event a run emits.
     */
    public boolean endsPipeline() {
        return this == PIPELINE_COMPLETED || this == PIPELINE_ERROR;
    }
}

package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a test run.
 */
public enum RunState {
    CREATED("created"),
    PARSING("parsing"),
    GENERATING("generating"),
    AWAITING_APPROVAL("awaiting_approval"),   // Waiting for a human to approve the generated cases
    EXECUTING("executing"),
    CODEX_REVIEWING("codex_reviewing"),
    CROSS_VALIDATING("cross_validating"),
    REPORT_READY("report_ready"),             // Waiting for a human to confirm the report
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    RunState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static RunState fromWireName(String value) {
        for (RunState state : values()) {
            if (state.wireName.equals(value) || state.name().equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown run state: " + value);
    }
}

package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a run ended in {@link RunState#FAILED}.
 */
public enum ReasonCode {
    RETRY_EXHAUSTED("retry_exhausted"),
    AGENT_TIMEOUT("agent_timeout"),
    APPROVAL_TIMEOUT("approval_timeout"),
    CONFIRM_TIMEOUT("confirm_timeout"),
    VERDICT_CONFLICT("verdict_conflict"),
    PLAYWRIGHT_ERROR("playwright_error"),
    QUALITY_GATE_BLOCKED("quality_gate_blocked"),
    INTERNAL_ERROR("internal_error");

    private final String wireName;

    ReasonCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ReasonCode fromWireName(String value) {
        for (ReasonCode code : values()) {
            if (code.wireName.equals(value) || code.name().equals(value)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown reason code: " + value);
    }
}

package com.smarttest.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of a step failure, used to pick a recovery action.
 */
public enum ErrorCategory {
    NETWORK("network"),
    TIMEOUT("timeout"),
    PLAYWRIGHT("playwright"),
    AI_AGENT("ai_agent"),
    VALIDATION("validation"),
    INTERNAL("internal");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package com.smarttest.core.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecoveryAction {
    RETRY("retry"),
    ROLLBACK("rollback"),
    SKIP("skip"),
    ABORT("abort");

    private final String wireName;

    RecoveryAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

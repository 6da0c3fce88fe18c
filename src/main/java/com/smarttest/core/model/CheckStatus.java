package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckStatus {
    PASS,
    FAIL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}

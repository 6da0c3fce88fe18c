package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of an assertion.
 */
public enum Verdict {
    PASS("pass"),
    FAIL("fail"),
    ERROR("error");

    private final String wireName;

    Verdict(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Verdict fromWireName(String value) {
        for (Verdict verdict : values()) {
            if (verdict.wireName.equals(value) || verdict.name().equals(value)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown verdict: " + value);
    }
}

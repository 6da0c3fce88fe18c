package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Second-opinion reviewer's stance on an assertion's verdict.
 */
public enum ReviewVerdict {
    AGREE("agree"),
    DISAGREE("disagree"),
    UNCERTAIN("uncertain");

    private final String wireName;

    ReviewVerdict(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ReviewVerdict fromWireName(String value) {
        for (ReviewVerdict verdict : values()) {
            if (verdict.wireName.equals(value) || verdict.name().equals(value)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown review verdict: " + value);
    }
}

package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of assertion. Every type except {@link #SOFT} is computed deterministically by the
 * browser runner; soft assertions are judged by an AI agent.
 */
public enum AssertionType {
    ELEMENT_VISIBLE("element_visible"),
    TEXT_CONTENT("text_content"),
    ELEMENT_COUNT("element_count"),
    NAVIGATION("navigation"),
    SOFT("soft");

    private final String wireName;

    AssertionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isDeterministic() {
        return this != SOFT;
    }

    @JsonCreator
    public static AssertionType fromWireName(String value) {
        for (AssertionType type : values()) {
            if (type.wireName.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown assertion type: " + value);
    }
}

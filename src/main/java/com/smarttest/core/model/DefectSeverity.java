package com.smarttest.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Defect severity, declared from most to least severe.
 */
public enum DefectSeverity {
    CRITICAL,
    MAJOR,
    MINOR,
    SUGGESTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static DefectSeverity forPriority(RequirementPriority priority) {
        if (priority == null) {
            return SUGGESTION;
        }
        return switch (priority) {
            case P0 -> CRITICAL;
            case P1 -> MAJOR;
            case P2 -> MINOR;
        };
    }
}

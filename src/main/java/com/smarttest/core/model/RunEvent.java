package com.smarttest.core.model;

/**
 * Signals that drive a run through its lifecycle.
 * <p>
 * {@link #RUN_CREATED} only labels the seed decision-log entry written when a run
 * is created; it never appears in the transition table.
 */
public enum RunEvent {
    RUN_CREATED,
    START_PARSING,
    PARSING_COMPLETE,
    GENERATION_COMPLETE,
    APPROVED,
    REJECTED,
    EXECUTION_COMPLETE,
    REVIEW_COMPLETE,
    VALIDATION_COMPLETE,
    CONFIRMED,
    RETEST,
    TIMEOUT,
    ERROR
}

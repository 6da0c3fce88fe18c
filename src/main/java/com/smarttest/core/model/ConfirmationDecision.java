package com.smarttest.core.model;

import java.time.Instant;

/**
 * Human decision on a finished report, valid only while a run is report-ready.
 * Exactly one of {@code confirmed} and {@code retest} must be set.
 */
public record ConfirmationDecision(
    boolean confirmed,
    boolean retest,
    String reviewerId,
    String comments,
    Instant timestamp
) {}

package com.smarttest.core.model;

import java.time.Instant;

/**
 * Human decision on the generated test cases, valid only while a run awaits approval.
 */
public record ApprovalDecision(
    boolean approved,
    String reviewerId,
    String comments,
    Instant timestamp
) {}

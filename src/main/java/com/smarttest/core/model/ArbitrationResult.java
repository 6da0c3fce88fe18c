package com.smarttest.core.model;

import java.io.Serializable;

/**
 * Outcome of merging an assertion's own verdict with its review.
 */
public record ArbitrationResult(
    String assertionId,
    Verdict originalVerdict,
    ReviewVerdict reviewVerdict,
    Verdict finalVerdict,
    String reason,
    boolean conflictDetected
) implements Serializable {}

package com.smarttest.core.model;

import java.io.Serializable;

/**
 * Reviewer's opinion on one assertion, already validated by the review collaborator.
 */
public record AssertionReview(
    String assertionId,
    String caseId,
    ReviewVerdict reviewVerdict,
    String reasoning
) implements Serializable {}

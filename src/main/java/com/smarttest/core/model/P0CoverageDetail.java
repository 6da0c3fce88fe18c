package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Coverage of a single testable P0 requirement.
 */
public record P0CoverageDetail(
    String requirementId,
    String title,
    boolean covered,
    List<String> testCaseIds
) implements Serializable {}

package com.smarttest.core.qualitygate;

/**
 * Final verdict counts over deterministic assertions.
 */
public record AprBreakdown(int totalDeterministic, int passed, int failed, int errors, double rate) {}

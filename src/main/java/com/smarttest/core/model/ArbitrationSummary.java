package com.smarttest.core.model;

import java.io.Serializable;

/**
 * Totals over a batch of arbitration results. {@code total == passed + failed + errors}.
 */
public record ArbitrationSummary(
    int total,
    int passed,
    int failed,
    int errors,
    int conflicts,
    double agreementRate
) implements Serializable {}

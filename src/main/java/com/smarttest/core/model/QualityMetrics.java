package com.smarttest.core.model;

import java.io.Serializable;

/**
 * Metrics stored on a run after cross-validation. {@code fr} is null when there is not
 * enough run history to compute it.
 */
public record QualityMetrics(
    QualityMetric rc,
    QualityMetric apr,
    QualityMetric fr
) implements Serializable {}

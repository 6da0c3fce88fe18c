package com.smarttest.core.model;

import java.io.Serializable;

/**
 * A metric value checked against its fixed threshold.
 */
public record QualityMetric(
    MetricName name,
    double value,
    double threshold,
    boolean passed
) implements Serializable {

    public static QualityMetric of(MetricName name, double value, double threshold) {
        boolean passed = name.lowerIsBetter() ? value <= threshold : value >= threshold;
        return new QualityMetric(name, value, threshold, passed);
    }
}

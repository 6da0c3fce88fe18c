package com.smarttest.core.model;

/**
 * Quality metrics tracked per run.
 */
public enum MetricName {
    /** Requirements coverage; higher is better. */
    RC,
    /** Assertion pass rate over deterministic assertions; higher is better. */
    APR,
    /** Flaky rate across historical runs; lower is better. */
    FR;

    public boolean lowerIsBetter() {
        return this == FR;
    }
}

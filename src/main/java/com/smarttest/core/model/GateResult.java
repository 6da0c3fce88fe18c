package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of evaluating the quality gate for a run.
 * <p>
 * The gate passes only when every metric passes its threshold and P0 coverage passes.
 * When denied, {@link #warnings} lists each failing element.
 */
public record GateResult(
    GateStatus status,
    List<QualityMetric> metrics,
    P0CoverageCheck p0Coverage,
    List<String> warnings
) implements Serializable {

    public GateResult {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean passed() {
        return status == GateStatus.PASSED;
    }
}

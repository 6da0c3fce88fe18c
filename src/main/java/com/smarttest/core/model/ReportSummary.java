package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Data handed to the report renderer.
 */
public record ReportSummary(
    int totalDefects,
    Map<DefectSeverity, Integer> severityDistribution,
    List<String> affectedRoutes,
    List<QualityMetric> qualityMetrics
) implements Serializable {}

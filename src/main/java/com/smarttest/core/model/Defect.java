package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A failure to be listed in the report, derived from one failed assertion.
 */
public record Defect(
    String id,
    DefectSeverity severity,
    String title,
    String assertionId,
    String caseId,
    String requirementId,
    String route,
    List<String> screenshots,
    List<String> operationSteps
) implements Serializable {

    public Defect {
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        operationSteps = operationSteps == null ? List.of() : List.copyOf(operationSteps);
    }
}

package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A generated UI test case.
 *
 * @param id            internal identifier
 * @param caseId        case identifier (e.g. "TC-001")
 * @param requirementId the requirement this case covers (internal or external id)
 * @param route         route exercised
 * @param title         short title
 * @param steps         ordered steps
 * @param assertionIds  ids of the assertions this case checks
 */
public record TestCase(
    String id,
    String caseId,
    String requirementId,
    String route,
    String title,
    List<TestStep> steps,
    List<String> assertionIds
) implements Serializable {

    public TestCase {
        steps = steps == null ? List.of() : List.copyOf(steps);
        assertionIds = assertionIds == null ? List.of() : List.copyOf(assertionIds);
    }
}

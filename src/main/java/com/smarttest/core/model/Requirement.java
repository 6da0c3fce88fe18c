package com.smarttest.core.model;

import java.io.Serializable;

/**
 * A requirement extracted from the PRD.
 *
 * @param id            internal identifier
 * @param requirementId identifier as written in the PRD (e.g. "REQ-001")
 * @param title         short title
 * @param priority      P0, P1 or P2
 * @param testable      whether the requirement can be verified through UI automation
 * @param route         route the requirement applies to
 */
public record Requirement(
    String id,
    String requirementId,
    String title,
    RequirementPriority priority,
    boolean testable,
    String route
) implements Serializable {

    /**
     * True when {@code reference} names this requirement by internal or external id.
     */
    public boolean isReferencedBy(String reference) {
        return reference != null && (reference.equals(id) || reference.equals(requirementId));
    }
}

package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the P0 coverage gate.
 *
 * @param status       {@link CheckStatus#PASS} iff {@code missingP0Ids} is empty
 * @param missingP0Ids external ids of testable P0 requirements without a test case
 */
public record P0CoverageCheck(
    CheckStatus status,
    List<String> missingP0Ids
) implements Serializable {

    public P0CoverageCheck {
        missingP0Ids = missingP0Ids == null ? List.of() : List.copyOf(missingP0Ids);
    }

    public boolean passed() {
        return status == CheckStatus.PASS;
    }
}

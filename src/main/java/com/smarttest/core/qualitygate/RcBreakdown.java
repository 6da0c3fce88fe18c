package com.smarttest.core.qualitygate;

import java.util.List;

/**
 * @param totalTestable number of testable requirements
 * @param covered       testable requirements with at least one test case
 * @param uncovered     external ids of the uncovered testable requirements
 * @param rate          {@code covered / totalTestable}, 1.0 when nothing is testable
 */
public record RcBreakdown(int totalTestable, int covered, List<String> uncovered, double rate) {

    public RcBreakdown {
        uncovered = List.copyOf(uncovered);
    }
}

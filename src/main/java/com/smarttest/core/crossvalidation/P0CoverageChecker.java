package com.smarttest.core.crossvalidation;

import com.smarttest.core.model.CheckStatus;
import com.smarttest.core.model.P0CoverageCheck;
import com.smarttest.core.model.P0CoverageDetail;
import com.smarttest.core.model.Requirement;
import com.smarttest.core.model.RequirementPriority;
import com.smarttest.core.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Hard gate: every testable P0 requirement must be covered by at least one test case.
 */
@Component
public class P0CoverageChecker {

    public P0CoverageCheck checkP0Coverage(List<Requirement> requirements, List<TestCase> testCases) {
        var missing = new ArrayList<String>();
        for (Requirement requirement : testableP0(requirements)) {
            if (coveringCases(requirement, testCases).isEmpty()) {
                missing.add(requirement.requirementId());
            }
        }
        return new P0CoverageCheck(missing.isEmpty() ? CheckStatus.PASS : CheckStatus.FAIL, missing);
    }

    /**
     * Covered fraction of testable P0 requirements; 1.0 when there are none.
     */
    public double calculateP0CoverageRate(List<Requirement> requirements, List<TestCase> testCases) {
        List<Requirement> p0 = testableP0(requirements);
        if (p0.isEmpty()) {
            return 1.0;
        }
        long covered = p0.stream()
                .filter(r -> !coveringCases(r, testCases).isEmpty())
                .count();
        return (double) covered / p0.size();
    }

    public List<P0CoverageDetail> getP0CoverageDetails(List<Requirement> requirements, List<TestCase> testCases) {
        return testableP0(requirements).stream()
                .map(r -> {
                    List<String> caseIds = coveringCases(r, testCases);
                    return new P0CoverageDetail(r.requirementId(), r.title(), !caseIds.isEmpty(), caseIds);
                })
                .toList();
    }

    static List<Requirement> testableP0(List<Requirement> requirements) {
        return requirements.stream()
                .filter(r -> r.priority() == RequirementPriority.P0 && r.testable())
                .toList();
    }

    private static List<String> coveringCases(Requirement requirement, List<TestCase> testCases) {
        return testCases.stream()
                .filter(tc -> requirement.isReferencedBy(tc.requirementId()))
                .map(TestCase::caseId)
                .toList();
    }
}

package com.smarttest.core.model;

import java.util.List;

/**
 * Builders for the small object graphs used across tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Requirement requirement(String id, RequirementPriority priority) {
        return new Requirement("db-" + id, id, "Requirement " + id, priority, true, "/" + id.toLowerCase());
    }

    public static Requirement untestable(String id, RequirementPriority priority) {
        return new Requirement("db-" + id, id, "Requirement " + id, priority, false, null);
    }

    public static TestCase testCase(String caseId, String requirementId, String route) {
        return new TestCase("tc-" + caseId, caseId, requirementId, route, "Case " + caseId,
                List.of(new TestStep(1, "open " + route, null), new TestStep(2, "fill email", "a@b.c")),
                List.of());
    }

    public static Assertion passing(String id, String caseId) {
        return Assertion.deterministic(id, caseId, AssertionType.ELEMENT_VISIBLE, "shows " + id, Verdict.PASS)
                .withFinalVerdict(Verdict.PASS);
    }

    public static Assertion failing(String id, String caseId) {
        return Assertion.deterministic(id, caseId, AssertionType.TEXT_CONTENT, "text of " + id, Verdict.FAIL)
                .withFinalVerdict(Verdict.FAIL);
    }

    public static RunHistoryEntry history(String runId, CaseResult... results) {
        return new RunHistoryEntry(runId, List.of(results));
    }

    public static CaseResult passed(String caseId) {
        return new CaseResult(caseId, TestCaseStatus.PASSED);
    }

    public static CaseResult failed(String caseId) {
        return new CaseResult(caseId, TestCaseStatus.FAILED);
    }
}

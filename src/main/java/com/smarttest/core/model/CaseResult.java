package com.smarttest.core.model;

import java.io.Serializable;

/**
 * How one test case ended in one run.
 */
public record CaseResult(String caseId, TestCaseStatus status) implements Serializable {

    public boolean passed() {
        return status == TestCaseStatus.PASSED;
    }
}

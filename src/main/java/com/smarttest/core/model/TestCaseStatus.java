package com.smarttest.core.model;

public enum TestCaseStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    ERROR
}

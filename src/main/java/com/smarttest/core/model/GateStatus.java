package com.smarttest.core.model;

/**
 * Overall quality-gate decision.
 */
public enum GateStatus {
    PASSED,
    FAILED
}

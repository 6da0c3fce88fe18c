package com.smarttest.core.model;

/**
 * Requirement priority tiers. P0 requirements must be covered by at least one test case.
 */
public enum RequirementPriority {
    P0,
    P1,
    P2
}

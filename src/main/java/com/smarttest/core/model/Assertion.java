package com.smarttest.core.model;

import java.io.Serializable;

/**
 * A single check within a test case.
 * <p>
 * Deterministic assertions carry a {@code machineVerdict}; soft assertions carry an
 * {@code agentVerdict}. {@code finalVerdict} is only set by arbitration.
 */
public record Assertion(
    String assertionId,
    String caseId,
    AssertionType type,
    String description,
    String expected,
    String actual,
    Verdict machineVerdict,
    Verdict agentVerdict,
    String agentReasoning,
    String evidencePath,
    Verdict finalVerdict
) implements Serializable {

    public Assertion {
        if (type == null) {
            throw new IllegalArgumentException("Assertion " + assertionId + " has no type");
        }
        if (type.isDeterministic() && agentVerdict != null) {
            throw new IllegalArgumentException(
                    "Deterministic assertion " + assertionId + " cannot carry an agent verdict");
        }
        if (!type.isDeterministic() && machineVerdict != null) {
            throw new IllegalArgumentException(
                    "Soft assertion " + assertionId + " cannot carry a machine verdict");
        }
    }

    public static Assertion deterministic(String assertionId, String caseId, AssertionType type,
                                          String description, Verdict machineVerdict) {
        return new Assertion(assertionId, caseId, type, description, null, null,
                machineVerdict, null, null, null, null);
    }

    public static Assertion soft(String assertionId, String caseId, String description,
                                 Verdict agentVerdict, String agentReasoning) {
        return new Assertion(assertionId, caseId, AssertionType.SOFT, description, null, null,
                null, agentVerdict, agentReasoning, null, null);
    }

    /**
     * The verdict that arbitration starts from; {@link Verdict#ERROR} when none was recorded.
     */
    public Verdict originalVerdict() {
        Verdict original = type.isDeterministic() ? machineVerdict : agentVerdict;
        return original != null ? original : Verdict.ERROR;
    }

    public Assertion withFinalVerdict(Verdict verdict) {
        return new Assertion(assertionId, caseId, type, description, expected, actual,
                machineVerdict, agentVerdict, agentReasoning, evidencePath, verdict);
    }

    public Assertion withEvidence(String path) {
        return new Assertion(assertionId, caseId, type, description, expected, actual,
                machineVerdict, agentVerdict, agentReasoning, path, finalVerdict);
    }
}

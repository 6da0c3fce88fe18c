package com.smarttest.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Case outcomes of one historical run, used to compute the flaky rate.
 */
public record RunHistoryEntry(String runId, List<CaseResult> caseResults) implements Serializable {

    public RunHistoryEntry {
        caseResults = caseResults == null ? List.of() : List.copyOf(caseResults);
    }
}

package com.smarttest.core.model;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Partial update applied atomically to a persisted run. {@code null} fields are left unchanged.
 * <p>
 * The decision log can only grow: a non-null {@code appendedEntry} is appended to it.
 */
public record RunUpdate(
    RunState state,
    ReasonCode reasonCode,
    Instant completedAt,
    DecisionLogEntry appendedEntry,
    QualityMetrics qualityMetrics,
    String reportPath
) {

    public static RunUpdate transition(RunState state, ReasonCode reasonCode,
                                       Instant completedAt, DecisionLogEntry entry) {
        return new RunUpdate(state, reasonCode, completedAt, entry, null, null);
    }

    public static RunUpdate qualityMetrics(QualityMetrics metrics) {
        return new RunUpdate(null, null, null, null, metrics, null);
    }

    public static RunUpdate reportPath(String reportPath) {
        return new RunUpdate(null, null, null, null, null, reportPath);
    }

    /**
     * Returns {@code run} with this update applied and {@code updatedAt} set to {@code now}.
     */
    public TestRun applyTo(TestRun run, Instant now) {
        var log = new ArrayList<>(run.decisionLog());
        if (appendedEntry != null) {
            log.add(appendedEntry);
        }
        return new TestRun(
                run.id(),
                run.projectId(),
                state != null ? state : run.state(),
                reasonCode != null ? reasonCode : run.reasonCode(),
                run.prdPath(),
                run.testedRoutes(),
                run.workspacePath(),
                run.envFingerprint(),
                run.agentVersions(),
                run.promptVersions(),
                log,
                qualityMetrics != null ? qualityMetrics : run.qualityMetrics(),
                reportPath != null ? reportPath : run.reportPath(),
                run.createdAt(),
                now,
                completedAt != null ? completedAt : run.completedAt());
    }
}

package com.smarttest.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One end-to-end execution of the test pipeline for a project.
 * <p>
 * Instances are snapshots; every mutation goes through the repository and yields a new record.
 *
 * @param id              run id (UUID)
 * @param projectId       owning project
 * @param state           current lifecycle state
 * @param reasonCode      set only when {@code state == FAILED}
 * @param prdPath         path of the PRD the run was generated from
 * @param testedRoutes    routes under test, in request order
 * @param workspacePath   per-run working directory
 * @param envFingerprint  opaque environment metadata
 * @param agentVersions   versions of the external agents used
 * @param promptVersions  versions of the prompts used
 * @param decisionLog     append-only audit trail
 * @param qualityMetrics  metrics computed at cross-validation, if any
 * @param reportPath      rendered report location, if any
 * @param createdAt       creation time
 * @param updatedAt       last persistence write
 * @param completedAt     set when a terminal state is reached
 */
public record TestRun(
    String id,
    String projectId,
    RunState state,
    ReasonCode reasonCode,
    String prdPath,
    List<String> testedRoutes,
    String workspacePath,
    Map<String, String> envFingerprint,
    Map<String, String> agentVersions,
    Map<String, String> promptVersions,
    List<DecisionLogEntry> decisionLog,
    QualityMetrics qualityMetrics,
    String reportPath,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) implements Serializable {

    public TestRun {
        testedRoutes = testedRoutes == null ? List.of() : List.copyOf(testedRoutes);
        envFingerprint = envFingerprint == null ? Map.of() : Map.copyOf(envFingerprint);
        agentVersions = agentVersions == null ? Map.of() : Map.copyOf(agentVersions);
        promptVersions = promptVersions == null ? Map.of() : Map.copyOf(promptVersions);
        decisionLog = decisionLog == null ? List.of() : List.copyOf(decisionLog);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Most recent decision-log entry that entered {@code target}.
     */
    public Optional<DecisionLogEntry> lastEntryInto(RunState target) {
        for (int i = decisionLog.size() - 1; i >= 0; i--) {
            DecisionLogEntry entry = decisionLog.get(i);
            if (entry.toState() == target) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Optional<DecisionLogEntry> lastEntry() {
        return decisionLog.isEmpty()
                ? Optional.empty()
                : Optional.of(decisionLog.get(decisionLog.size() - 1));
    }
}

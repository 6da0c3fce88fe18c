package com.smarttest.core.engine;

import com.smarttest.core.model.RunState;
import com.smarttest.core.recovery.ErrorContext;
import com.smarttest.core.statemachine.IdempotencyKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile per-run bookkeeping owned by whoever drives the run.
 * <p>
 * Holds the idempotency keys already applied to the run and the error history of its steps.
 * Nothing here is persisted; after a restart duplicate events degrade to table no-ops.
 */
public final class RunContext {

    private final String runId;
    private final Map<IdempotencyKey, RunState> appliedKeys = new ConcurrentHashMap<>();
    private final Map<String, List<ErrorContext>> errorHistory = new LinkedHashMap<>();

    public RunContext(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
    }

    public String runId() {
        return runId;
    }

    /**
     * Target state recorded for a previously applied key.
     */
    public Optional<RunState> appliedTarget(IdempotencyKey key) {
        return Optional.ofNullable(appliedKeys.get(key));
    }

    /**
     * Records {@code key} as applied and forgets keys captured during an earlier visit to
     * {@code target}, so a re-entered state accepts its events again.
     */
    public void recordApplied(IdempotencyKey key, RunState target) {
        appliedKeys.keySet().removeIf(k -> k.fromState() == target);
        appliedKeys.put(key, target);
    }

    public int appliedKeyCount() {
        return appliedKeys.size();
    }

    public synchronized void recordError(ErrorContext error) {
        errorHistory.computeIfAbsent(error.step(), k -> new ArrayList<>()).add(error);
    }

    /**
     * Recorded errors for {@code step}, or for all steps in recording order when {@code step} is null.
     */
    public synchronized List<ErrorContext> errorHistory(String step) {
        if (step != null) {
            return List.copyOf(errorHistory.getOrDefault(step, List.of()));
        }
        var all = new ArrayList<ErrorContext>();
        errorHistory.values().forEach(all::addAll);
        all.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
        return List.copyOf(all);
    }

    public synchronized void clearErrors(String step) {
        errorHistory.remove(step);
    }
}

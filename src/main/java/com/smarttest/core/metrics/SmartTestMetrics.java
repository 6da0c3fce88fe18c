package com.smarttest.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for test-run execution.
 */
@Service
public class SmartTestMetrics {

    private final MeterRegistry registry;

    public SmartTestMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String fromState, String toState, String event) {
        Counter.builder("smarttest.transitions.total")
                .tag("from", fromState)
                .tag("to", toState)
                .tag("event", event)
                .register(registry)
                .increment();
    }

    /**
     * Counts events rejected by the state machine, e.g. approvals arriving after a timeout.
     */
    public void recordRejectedTransition(String state, String event) {
        Counter.builder("smarttest.transitions.rejected")
                .tag("state", state)
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordDuplicateEvent(String event) {
        Counter.builder("smarttest.transitions.duplicates")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    /**
     * @param state      terminal state the run reached
     * @param reasonCode failure reason, or "none" for completed runs
     */
    public void recordRunResult(String state, String reasonCode) {
        Counter.builder("smarttest.runs.total")
                .tag("state", state)
                .tag("reason", reasonCode)
                .register(registry)
                .increment();
    }

    public void recordStepDuration(String step, long ms) {
        Timer.builder("smarttest.step.duration")
                .tag("step", step)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRecoveryDecision(String category, String action) {
        Counter.builder("smarttest.recovery.decisions")
                .tag("category", category)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordGateEvaluation(boolean passed) {
        Counter.builder("smarttest.gate.evaluations")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordArbitrationConflicts(int conflicts) {
        DistributionSummary.builder("smarttest.arbitration.conflicts")
                .description("Verdict conflicts per cross-validation")
                .register(registry)
                .record(conflicts);
    }

    public void recordDefects(int count) {
        DistributionSummary.builder("smarttest.defects.per_run")
                .register(registry)
                .record(count);
    }
}

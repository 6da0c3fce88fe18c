package com.smarttest.core.pipeline;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.RunContext;
import com.smarttest.core.engine.TransitionException;
import com.smarttest.core.events.EventChannel;
import com.smarttest.core.events.PipelineEvent;
import com.smarttest.core.events.PipelineEventType;
import com.smarttest.core.logging.MdcContext;
import com.smarttest.core.metrics.SmartTestMetrics;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.TransitionOptions;
import com.smarttest.core.recovery.ErrorCategory;
import com.smarttest.core.recovery.ErrorContext;
import com.smarttest.core.recovery.ErrorRecoveryManager;
import com.smarttest.core.recovery.RecoveryDecision;
import com.smarttest.core.recovery.Sleeper;
import com.smarttest.core.statemachine.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes pipeline steps for a run, retrying failures as {@link ErrorRecoveryManager} decides.
 * <p>
 * Retries are invisible to the run's state. When recovery aborts, the run is driven to
 * {@code failed} through an ERROR transition whose error type reflects the failure.
 */
@Service
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    static final String ERROR_TYPE_INTERNAL = "internal";

    private final Orchestrator orchestrator;
    private final ErrorRecoveryManager recovery;
    private final EventChannel events;
    private final SmartTestMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public StepRunner(Orchestrator orchestrator, ErrorRecoveryManager recovery, EventChannel events,
                      SmartTestMetrics metrics, Clock clock) {
        this(orchestrator, recovery, events, metrics, clock, Sleeper.SYSTEM);
    }

    public StepRunner(Orchestrator orchestrator, ErrorRecoveryManager recovery, EventChannel events,
                      SmartTestMetrics metrics, Clock clock, Sleeper sleeper) {
        this.orchestrator = orchestrator;
        this.recovery = recovery;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs {@code step} until it succeeds or recovery gives up.
     *
     * @return the step's result
     * @throws StepFailedException when recovery aborts
     */
    public <T> T runStep(RunContext context, String stepName, PipelineStep<T> step) {
        String runId = context.runId();
        boolean ownsMdc = !MdcContext.hasRun();
        MdcContext.setStep(runId, stepName);
        try {
            int attempt = 0;
            while (true) {
                attempt++;
                publish(PipelineEventType.STEP_STARTED, runId, Map.of("step", stepName, "attempt", attempt));
                long start = clock.millis();
                try {
                    T result = step.execute();
                    long elapsed = clock.millis() - start;
                    metrics.recordStepDuration(stepName, elapsed);
                    publish(PipelineEventType.STEP_COMPLETED, runId,
                            Map.of("step", stepName, "attempt", attempt, "durationMs", elapsed));
                    return result;
                } catch (Exception e) {
                    var error = new ErrorContext(runId, stepName, orchestrator.getState(runId), e, attempt,
                            clock.instant());
                    RecoveryDecision decision = recovery.determineRecovery(context, error);
                    if (decision.isRetry()) {
                        log.warn("Step '{}' attempt {} failed: {}. Retrying in {} ms",
                                stepName, attempt, e.getMessage(), decision.delay().toMillis());
                        waitBeforeRetry(decision, stepName, attempt, e);
                        continue;
                    }
                    throw abort(context, stepName, attempt, decision, e);
                }
            }
        } finally {
            if (ownsMdc) {
                MdcContext.clear();
            } else {
                MdcContext.clearStep();
            }
        }
    }

    private void waitBeforeRetry(RecoveryDecision decision, String stepName, int attempt, Exception cause) {
        try {
            sleeper.sleep(decision.delay());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            var failure = new StepFailedException(stepName, attempt, decision, cause);
            failure.addSuppressed(ie);
            throw failure;
        }
    }

    private StepFailedException abort(RunContext context, String stepName, int attempt,
                                      RecoveryDecision decision, Exception cause) {
        String errorType = errorTypeFor(decision, attempt);
        log.error("Step '{}' aborted after {} attempt(s) [{}]: {}",
                stepName, attempt, decision.category().wireName(), cause.getMessage());

        var data = new LinkedHashMap<String, Object>();
        data.put("step", stepName);
        data.put("attempts", attempt);
        data.put("category", decision.category().wireName());
        data.put("message", String.valueOf(cause.getMessage()));
        publish(PipelineEventType.STEP_FAILED, context.runId(), data);

        var failure = new StepFailedException(stepName, attempt, decision, cause);
        var metadata = new LinkedHashMap<String, Object>(data);
        metadata.put("errorType", errorType);
        try {
            orchestrator.transition(context, RunEvent.ERROR,
                    new TransitionOptions(stepName + " failed: " + cause.getMessage(), metadata, null, errorType));
        } catch (TransitionException te) {
            log.warn("Could not mark run {} as failed: {}", context.runId(), te.getMessage());
            failure.addSuppressed(te);
        }
        return failure;
    }

    String errorTypeFor(RecoveryDecision decision, int attempt) {
        if (attempt >= recovery.maxAttempts()) {
            return ReasonCodes.RETRY_EXHAUSTED;
        }
        ErrorCategory category = decision.category();
        return switch (category) {
            case PLAYWRIGHT -> ReasonCodes.PLAYWRIGHT;
            case TIMEOUT -> ReasonCodes.AGENT_TIMEOUT;
            default -> ERROR_TYPE_INTERNAL;
        };
    }

    private void publish(PipelineEventType type, String runId, Map<String, Object> data) {
        events.publish(new PipelineEvent(type, runId, data, clock.instant()));
    }
}

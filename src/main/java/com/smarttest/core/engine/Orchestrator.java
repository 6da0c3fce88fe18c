package com.smarttest.core.engine;

import com.smarttest.core.events.EventChannel;
import com.smarttest.core.events.PipelineEvent;
import com.smarttest.core.events.PipelineEventType;
import com.smarttest.core.logging.MdcContext;
import com.smarttest.core.metrics.SmartTestMetrics;
import com.smarttest.core.model.ApprovalDecision;
import com.smarttest.core.model.ConfirmationDecision;
import com.smarttest.core.model.CreateRunInput;
import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.QualityMetrics;
import com.smarttest.core.model.ReasonCode;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.RunUpdate;
import com.smarttest.core.model.TestRun;
import com.smarttest.core.model.TransitionOptions;
import com.smarttest.core.persistence.ProjectRepository;
import com.smarttest.core.persistence.RunRepository;
import com.smarttest.core.statemachine.ReasonCodes;
import com.smarttest.core.statemachine.StateMachine;
import com.smarttest.core.statemachine.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the lifecycle of test runs.
 * <p>
 * Every state change goes through {@link #transition}: the state machine decides, the repository
 * persists the new state together with its decision-log entry in one update, and only then are
 * outbound events published.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final Map<String, String> DEFAULT_AGENT_VERSIONS = Map.of(
            "claudeCode", "unknown",
            "codex", "unknown");

    static final Map<String, String> DEFAULT_PROMPT_VERSIONS = Map.of(
            "prdParse", "v1",
            "uiTestExecute", "v1",
            "reviewResults", "v1");

    private final RunRepository runRepository;
    private final ProjectRepository projectRepository;
    private final StateMachine stateMachine;
    private final EventChannel events;
    private final SmartTestMetrics metrics;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public Orchestrator(RunRepository runRepository,
                        ProjectRepository projectRepository,
                        StateMachine stateMachine,
                        EventChannel events,
                        SmartTestMetrics metrics,
                        OrchestratorProperties properties,
                        Clock clock) {
        this.runRepository = runRepository;
        this.projectRepository = projectRepository;
        this.stateMachine = stateMachine;
        this.events = events;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a run in {@link RunState#CREATED} for an existing project.
     *
     * @throws ValidationException  if the project id or PRD path is missing
     * @throws NotFoundException if the project does not exist
     */
    public TestRun createRun(CreateRunInput input) {
        if (input.projectId() == null || input.projectId().isBlank()) {
            throw new ValidationException("projectId is required");
        }
        if (input.prdPath() == null || input.prdPath().isBlank()) {
            throw new ValidationException("prdPath is required");
        }
        projectRepository.findById(input.projectId())
                .orElseThrow(() -> NotFoundException.project(input.projectId()));

        String runId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        var seed = new DecisionLogEntry(now, RunState.CREATED, RunState.CREATED, RunEvent.RUN_CREATED,
                "Test run created", Map.of());

        var run = new TestRun(
                runId,
                input.projectId(),
                RunState.CREATED,
                null,
                input.prdPath(),
                input.routes(),
                Path.of(properties.getWorkspaceRoot(), runId).toString(),
                input.envFingerprint(),
                input.agentVersions() != null ? input.agentVersions() : DEFAULT_AGENT_VERSIONS,
                input.promptVersions() != null ? input.promptVersions() : DEFAULT_PROMPT_VERSIONS,
                List.of(seed),
                null,
                null,
                now,
                now,
                null);

        TestRun created = runRepository.create(run);
        boolean ownsMdc = !MdcContext.hasRun();
        if (ownsMdc) {
            MdcContext.setRun(runId, input.projectId());
        }
        try {
            log.info("Created test run {} for project {} ({} routes)",
                    runId, input.projectId(), created.testedRoutes().size());
        } finally {
            if (ownsMdc) {
                MdcContext.clear();
            }
        }
        return created;
    }

    public TestRun getRun(String runId) {
        return runRepository.findById(runId).orElseThrow(() -> NotFoundException.run(runId));
    }

    public RunState getState(String runId) {
        return getRun(runId).state();
    }

    public List<TestRun> getRunsForProject(String projectId) {
        return runRepository.findByProjectId(projectId);
    }

    public List<TestRun> getRunsByState(RunState state) {
        return runRepository.findByState(state);
    }

    public List<TestRun> getRecentRuns(int limit) {
        return runRepository.findRecent(limit);
    }

    public TestRun updateQualityMetrics(String runId, QualityMetrics qualityMetrics) {
        return runRepository.update(runId, RunUpdate.qualityMetrics(qualityMetrics));
    }

    public TestRun updateReportPath(String runId, String reportPath) {
        return runRepository.update(runId, RunUpdate.reportPath(reportPath));
    }

    public TestRun transition(RunContext context, RunEvent event) {
        return transition(context, event, TransitionOptions.none());
    }

    /**
     * Applies {@code event} to the run identified by {@code context}.
     *
     * @return the run after the transition; unchanged when the event was a duplicate or late no-op
     * @throws NotFoundException if the run does not exist
     * @throws TransitionException  if the event is illegal in the current state; nothing is persisted
     * @throws com.smarttest.core.persistence.PersistenceException if the run could not be stored;
     *         the event is not remembered and may be sent again
     */
    public TestRun transition(RunContext context, RunEvent event, TransitionOptions options) {
        String runId = context.runId();
        TestRun run = getRun(runId);
        boolean ownsMdc = !MdcContext.hasRun();
        MdcContext.setRun(runId, run.projectId());
        try {
            TransitionResult result = stateMachine.transition(context, run.state(), event,
                    options.shardId(), options.reason(), options.metadata());

            if (!result.success()) {
                metrics.recordRejectedTransition(run.state().wireName(), event.name());
                log.warn("Rejected {} for run {}: {}", event, runId, result.error());
                throw new TransitionException(runId, run.state(), event, result.error());
            }
            if (result.isNoOp()) {
                metrics.recordDuplicateEvent(event.name());
                log.debug("Event {} was a no-op for run {} in state {}", event, runId, run.state().wireName());
                return run;
            }

            DecisionLogEntry entry = clampToLog(result.logEntry(), run);
            RunState newState = result.newState();
            ReasonCode reasonCode = ReasonCodes.resolve(run.state(), newState, event, options.errorType());
            Instant completedAt = newState.isTerminal() ? entry.timestamp() : null;

            TestRun updated = runRepository.update(runId,
                    RunUpdate.transition(newState, reasonCode, completedAt, entry));
            context.recordApplied(result.key(), newState);

            metrics.recordTransition(run.state().wireName(), newState.wireName(), event.name());
            if (newState.isTerminal()) {
                metrics.recordRunResult(newState.wireName(), reasonCode != null ? reasonCode.wireName() : "none");
            }
            log.info("Run {} transitioned {} -> {} on {}{}", runId, run.state().wireName(), newState.wireName(),
                    event, reasonCode != null ? " (" + reasonCode.wireName() + ")" : "");

            publishTransitionEvents(updated, entry, reasonCode);
            return updated;
        } finally {
            if (ownsMdc) {
                MdcContext.clear();
            }
        }
    }

    /**
     * Resolves the human approval gate.
     *
     * @throws TransitionException if the run is not awaiting approval
     */
    public TestRun handleApproval(RunContext context, ApprovalDecision decision) {
        TestRun run = getRun(context.runId());
        RunEvent event = decision.approved() ? RunEvent.APPROVED : RunEvent.REJECTED;
        if (run.state() != RunState.AWAITING_APPROVAL) {
            throw new TransitionException(run.id(), run.state(), event,
                    "Run is not awaiting approval (state: " + run.state().wireName() + ")");
        }
        var metadata = reviewerMetadata(decision.reviewerId(), decision.timestamp());
        metadata.put("approved", decision.approved());
        return transition(context, event,
                new TransitionOptions(decision.comments(), metadata, null, null));
    }

    /**
     * Resolves the human report-confirmation gate.
     *
     * @throws ValidationException if the decision is not exactly one of confirm or retest
     * @throws TransitionException if the run is not waiting for confirmation
     */
    public TestRun handleConfirmation(RunContext context, ConfirmationDecision decision) {
        if (decision.confirmed() == decision.retest()) {
            throw new ValidationException("Confirmation must either confirm or request a retest, not "
                    + (decision.confirmed() ? "both" : "neither"));
        }
        TestRun run = getRun(context.runId());
        RunEvent event = decision.confirmed() ? RunEvent.CONFIRMED : RunEvent.RETEST;
        if (run.state() != RunState.REPORT_READY) {
            throw new TransitionException(run.id(), run.state(), event,
                    "Run is not waiting for report confirmation (state: " + run.state().wireName() + ")");
        }
        var metadata = reviewerMetadata(decision.reviewerId(), decision.timestamp());
        metadata.put("retest", decision.retest());
        return transition(context, event,
                new TransitionOptions(decision.comments(), metadata, null, null));
    }

    public Optional<TestRun> checkApprovalTimeout(RunContext context) {
        return checkGateTimeout(context, RunState.AWAITING_APPROVAL);
    }

    public Optional<TestRun> checkConfirmationTimeout(RunContext context) {
        return checkGateTimeout(context, RunState.REPORT_READY);
    }

    /**
     * Times out every run whose human gate has expired.
     *
     * @return the runs that were moved to {@link RunState#FAILED}
     */
    public List<TestRun> checkAllTimeouts() {
        var timedOut = new ArrayList<TestRun>();
        for (RunState gate : List.of(RunState.AWAITING_APPROVAL, RunState.REPORT_READY)) {
            for (TestRun run : runRepository.findByState(gate)) {
                checkGateTimeout(new RunContext(run.id()), gate).ifPresent(timedOut::add);
            }
        }
        return timedOut;
    }

    private Optional<TestRun> checkGateTimeout(RunContext context, RunState gate) {
        TestRun run = getRun(context.runId());
        if (run.state() != gate) {
            return Optional.empty();
        }
        Duration sla = GateTimeouts.slaFor(gate);
        if (!GateTimeouts.hasTimedOut(run, gate, sla, clock.instant())) {
            return Optional.empty();
        }
        String what = gate == RunState.AWAITING_APPROVAL ? "Approval" : "Report confirmation";
        String reason = what + " not received within " + sla.toHours() + "h";
        return Optional.of(transition(context, RunEvent.TIMEOUT,
                new TransitionOptions(reason, Map.of("sla", sla.toString()), null, null)));
    }

    private static Map<String, Object> reviewerMetadata(String reviewerId, Instant decidedAt) {
        var metadata = new HashMap<String, Object>();
        if (reviewerId != null) {
            metadata.put("reviewerId", reviewerId);
        }
        if (decidedAt != null) {
            metadata.put("decidedAt", decidedAt.toString());
        }
        return metadata;
    }

    /**
     * Keeps the decision log non-decreasing if the clock steps backwards.
     */
    private static DecisionLogEntry clampToLog(DecisionLogEntry entry, TestRun run) {
        return run.lastEntry()
                .filter(last -> entry.timestamp().isBefore(last.timestamp()))
                .map(last -> entry.withTimestamp(last.timestamp()))
                .orElse(entry);
    }

    private void publishTransitionEvents(TestRun run, DecisionLogEntry entry, ReasonCode reasonCode) {
        var data = new LinkedHashMap<String, Object>();
        data.put("from", entry.fromState().wireName());
        data.put("to", entry.toState().wireName());
        data.put("event", entry.event().name());
        if (reasonCode != null) {
            data.put("reasonCode", reasonCode.wireName());
        }
        events.publish(new PipelineEvent(PipelineEventType.STATE_TRANSITION, run.id(), data, entry.timestamp()));

        switch (run.state()) {
            case AWAITING_APPROVAL -> events.publish(new PipelineEvent(PipelineEventType.APPROVAL_REQUIRED,
                    run.id(), Map.of("deadline", entry.timestamp().plus(GateTimeouts.APPROVAL_SLA).toString()),
                    entry.timestamp()));
            case REPORT_READY -> events.publish(new PipelineEvent(PipelineEventType.CONFIRMATION_REQUIRED,
                    run.id(), confirmationData(run, entry), entry.timestamp()));
            case COMPLETED -> events.publish(new PipelineEvent(PipelineEventType.PIPELINE_COMPLETED,
                    run.id(), Map.of("completedAt", entry.timestamp().toString()), entry.timestamp()));
            case FAILED -> {
                var errorData = new LinkedHashMap<String, Object>();
                errorData.put("reasonCode", reasonCode != null ? reasonCode.wireName() : ReasonCode.INTERNAL_ERROR.wireName());
                errorData.put("failedIn", entry.fromState().wireName());
                if (entry.reason() != null) {
                    errorData.put("message", entry.reason());
                }
                events.publish(new PipelineEvent(PipelineEventType.PIPELINE_ERROR, run.id(), errorData,
                        entry.timestamp()));
            }
            default -> { }
        }
    }

    private static Map<String, Object> confirmationData(TestRun run, DecisionLogEntry entry) {
        var data = new LinkedHashMap<String, Object>();
        data.put("deadline", entry.timestamp().plus(GateTimeouts.CONFIRMATION_SLA).toString());
        if (run.reportPath() != null) {
            data.put("reportPath", run.reportPath());
        }
        return data;
    }
}

package com.smarttest.core.recovery;

import com.smarttest.core.engine.RunContext;
import com.smarttest.core.model.RunState;
import com.smarttest.core.metrics.SmartTestMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a failed pipeline step is retried or aborted.
 * <p>
 * Decisions depend only on the error category, the attempt number and the retry policy.
 * Error history is recorded in the caller's {@link RunContext}.
 */
@Service
public class ErrorRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryManager.class);

    private static final Map<RunState, RunState> ROLLBACK_TARGETS = new EnumMap<>(RunState.class);

    static {
        ROLLBACK_TARGETS.put(RunState.PARSING, RunState.CREATED);
        ROLLBACK_TARGETS.put(RunState.GENERATING, RunState.PARSING);
        ROLLBACK_TARGETS.put(RunState.EXECUTING, RunState.AWAITING_APPROVAL);
        ROLLBACK_TARGETS.put(RunState.CODEX_REVIEWING, RunState.EXECUTING);
        ROLLBACK_TARGETS.put(RunState.CROSS_VALIDATING, RunState.CODEX_REVIEWING);
    }

    private final RetryProperties retry;
    private final ErrorClassifier classifier;
    private final SmartTestMetrics metrics;

    @Autowired
    public ErrorRecoveryManager(RetryProperties retry,
                                @Autowired(required = false) SmartTestMetrics metrics) {
        this(retry, new ErrorClassifier(), metrics);
    }

    public ErrorRecoveryManager(RetryProperties retry, ErrorClassifier classifier, SmartTestMetrics metrics) {
        this.retry = retry;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public int maxAttempts() {
        return retry.getMaxAttempts();
    }

    public ErrorCategory classifyError(Throwable error) {
        return classifier.classify(error);
    }

    /**
     * Records the failure in {@code context} and decides how to proceed.
     */
    public RecoveryDecision determineRecovery(RunContext context, ErrorContext error) {
        context.recordError(error);
        RecoveryDecision decision = decide(error);
        log.info("Recovery for step '{}' attempt {}: {} ({})",
                error.step(), error.attemptCount(), decision.action().wireName(), decision.reason());
        if (metrics != null) {
            metrics.recordRecoveryDecision(decision.category().wireName(), decision.action().wireName());
        }
        return decision;
    }

    private RecoveryDecision decide(ErrorContext error) {
        ErrorCategory category = classifyError(error.error());
        int attempt = error.attemptCount();
        RunState rollback = getRollbackState(error.state()).orElse(null);

        if (attempt >= retry.getMaxAttempts()) {
            return RecoveryDecision.abort(
                    "Max retry attempts (" + retry.getMaxAttempts() + ") reached for "
                            + category.wireName() + " error",
                    category, rollback);
        }

        return switch (category) {
            case NETWORK -> RecoveryDecision.retry(calculateDelay(attempt),
                    "Network error, retrying with exponential backoff", category);
            case TIMEOUT -> RecoveryDecision.retry(calculateDelay(attempt),
                    "Timeout error, retrying", category);
            case PLAYWRIGHT -> attempt < 2
                    ? RecoveryDecision.retry(calculateDelay(attempt),
                            "Browser error, element may not be ready yet", category)
                    : RecoveryDecision.abort("Browser error persists after retry, likely a selector issue",
                            category, rollback);
            case AI_AGENT -> RecoveryDecision.retry(calculateDelay(attempt).multipliedBy(2),
                    "AI agent error, retrying with a longer delay", category);
            case VALIDATION -> RecoveryDecision.abort("Validation error, input cannot be fixed by retrying",
                    category, rollback);
            case INTERNAL -> attempt < 2
                    ? RecoveryDecision.retry(calculateDelay(attempt), "Internal error, retrying once", category)
                    : RecoveryDecision.abort("Internal error persists", category, rollback);
        };
    }

    /**
     * Backoff delay before retrying after the {@code attemptCount}-th failed attempt (1-based).
     */
    public Duration calculateDelay(int attemptCount) {
        double raw = retry.getBaseDelayMs()
                * Math.pow(retry.getBackoffMultiplier(), Math.max(0, attemptCount - 1));
        long capped = (long) Math.min(raw, retry.getMaxDelayMs());
        return Duration.ofMillis(capped);
    }

    public boolean isRecoverable(Throwable error) {
        return classifyError(error) != ErrorCategory.VALIDATION;
    }

    public Optional<RunState> getRollbackState(RunState state) {
        return Optional.ofNullable(ROLLBACK_TARGETS.get(state));
    }

    public List<ErrorContext> getErrorHistory(RunContext context, String step) {
        return context.errorHistory(step);
    }

    /**
     * Structured description of a failure for logging. Does not record the failure.
     */
    public Map<String, Object> createErrorReport(ErrorContext error) {
        RecoveryDecision decision = decide(error);
        var decisionMap = new LinkedHashMap<String, Object>();
        decisionMap.put("action", decision.action().wireName());
        decisionMap.put("reason", decision.reason());
        if (decision.delay() != null) {
            decisionMap.put("delayMs", decision.delay().toMillis());
        }

        var report = new LinkedHashMap<String, Object>();
        report.put("runId", error.runId());
        report.put("step", error.step());
        report.put("state", error.state() != null ? error.state().wireName() : null);
        report.put("category", decision.category().wireName());
        report.put("message", error.error().getMessage());
        report.put("errorClass", error.error().getClass().getName());
        report.put("attemptCount", error.attemptCount());
        report.put("timestamp", error.timestamp().toString());
        report.put("decision", decisionMap);
        return report;
    }
}

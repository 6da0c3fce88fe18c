package com.smarttest.core.statemachine;

import com.smarttest.core.model.ReasonCode;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;

/**
 * Maps the state being exited, and for errors the error type, to a failure reason code.
 */
public final class ReasonCodes {

    public static final String PLAYWRIGHT = "playwright";
    public static final String VERDICT_CONFLICT = "verdict_conflict";
    public static final String RETRY_EXHAUSTED = "retry_exhausted";
    public static final String AGENT_TIMEOUT = "agent_timeout";
    public static final String QUALITY_GATE_BLOCKED = "quality_gate_blocked";

    private ReasonCodes() {}

    public static ReasonCode forTimeout(RunState exitedState) {
        return switch (exitedState) {
            case AWAITING_APPROVAL -> ReasonCode.APPROVAL_TIMEOUT;
            case REPORT_READY -> ReasonCode.CONFIRM_TIMEOUT;
            default -> ReasonCode.AGENT_TIMEOUT;
        };
    }

    public static ReasonCode forError(RunState exitedState, String errorType) {
        if (errorType == null) {
            return ReasonCode.INTERNAL_ERROR;
        }
        return switch (errorType) {
            case PLAYWRIGHT -> ReasonCode.PLAYWRIGHT_ERROR;
            case VERDICT_CONFLICT -> ReasonCode.VERDICT_CONFLICT;
            case RETRY_EXHAUSTED -> ReasonCode.RETRY_EXHAUSTED;
            case AGENT_TIMEOUT -> ReasonCode.AGENT_TIMEOUT;
            case QUALITY_GATE_BLOCKED -> ReasonCode.QUALITY_GATE_BLOCKED;
            default -> ReasonCode.INTERNAL_ERROR;
        };
    }

    /**
     * Reason code for a transition into {@link RunState#FAILED}; null for any other target.
     */
    public static ReasonCode resolve(RunState exitedState, RunState target, RunEvent event, String errorType) {
        if (target != RunState.FAILED) {
            return null;
        }
        return event == RunEvent.TIMEOUT
                ? forTimeout(exitedState)
                : forError(exitedState, errorType);
    }
}

package com.smarttest.core.pipeline;

import com.smarttest.core.recovery.RecoveryDecision;

/**
 * Thrown when a pipeline step fails and recovery decides to abort. The run has been moved to
 * {@code failed} before this is thrown, unless its state did not allow it.
 */
public class StepFailedException extends RuntimeException {

    private final String step;
    private final int attempts;
    private final transient RecoveryDecision decision;

    public StepFailedException(String step, int attempts, RecoveryDecision decision, Throwable cause) {
        super("Step '" + step + "' failed after " + attempts + " attempt(s): " + decision.reason(), cause);
        this.step = step;
        this.attempts = attempts;
        this.decision = decision;
    }

    public String getStep() {
        return step;
    }

    public int getAttempts() {
        return attempts;
    }

    public RecoveryDecision getDecision() {
        return decision;
    }
}

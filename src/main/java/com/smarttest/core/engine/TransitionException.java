package com.smarttest.core.engine;

import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;

/**
 * Thrown when an event is not legal for the run's current state. The run is left untouched.
 */
public class TransitionException extends RuntimeException {

    private final String runId;
    private final RunState currentState;
    private final RunEvent event;

    public TransitionException(String runId, RunState currentState, RunEvent event, String message) {
        super(message);
        this.runId = runId;
        this.currentState = currentState;
        this.event = event;
    }

    public String getRunId() {
        return runId;
    }

    public RunState getCurrentState() {
        return currentState;
    }

    public RunEvent getEvent() {
        return event;
    }
}

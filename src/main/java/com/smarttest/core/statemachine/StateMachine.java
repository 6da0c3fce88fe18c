package com.smarttest.core.statemachine;

import com.smarttest.core.engine.RunContext;
import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Pure transition function over {@code (state, event)} with duplicate suppression.
 * <p>
 * Holds no per-run state of its own and never mutates the caller's {@link RunContext}. An applied
 * result carries the idempotency key the caller records after the transition has been persisted,
 * so a failed write leaves the event retryable.
 */
@Component
public class StateMachine {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private final Clock clock;

    public StateMachine(Clock clock) {
        this.clock = clock;
    }

    public TransitionResult transition(RunContext context, RunState currentState, RunEvent event) {
        return transition(context, currentState, event, null, null, null);
    }

    /**
     * Attempts to apply {@code event} to a run in {@code currentState}.
     *
     * @param context      per-run context holding applied idempotency keys
     * @param currentState state the run is in now
     * @param event        event to apply
     * @param shardId      optional shard discriminator for the idempotency key
     * @param reason       optional reason recorded in the log entry
     * @param metadata     optional metadata recorded in the log entry
     * @return the outcome; rejected results never carry a log entry
     */
    public TransitionResult transition(RunContext context, RunState currentState, RunEvent event,
                                       String shardId, String reason, Map<String, Object> metadata) {
        if (currentState.isTerminal()) {
            return TransitionResult.rejected(currentState,
                    "Cannot transition from terminal state: " + currentState.wireName());
        }

        var key = new IdempotencyKey(context.runId(), currentState, event, shardId);
        Optional<RunState> replayed = context.appliedTarget(key);
        if (replayed.isPresent()) {
            log.debug("Duplicate event {} suppressed for run {}", key, context.runId());
            return TransitionResult.noOp(replayed.get());
        }

        Optional<RunState> target = TransitionTable.targetState(currentState, event);
        if (target.isEmpty()) {
            return TransitionResult.rejected(currentState,
                    "Invalid transition: " + currentState.wireName() + " + " + event);
        }

        RunState newState = target.get();
        if (newState == currentState) {
            log.debug("Event {} is a no-op in state {} for run {}", event, currentState, context.runId());
            return TransitionResult.noOp(currentState);
        }

        var entry = new DecisionLogEntry(clock.instant(), currentState, newState, event, reason, metadata);
        return TransitionResult.applied(key, entry);
    }
}

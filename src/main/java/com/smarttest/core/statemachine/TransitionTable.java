package com.smarttest.core.statemachine;

import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.smarttest.core.model.RunEvent.*;
import static com.smarttest.core.model.RunState.*;

/**
 * The fixed table of legal {@code (state, event) -> state} transitions.
 * <p>
 * Entries that map a state to itself absorb late duplicates of the step-completion event
 * that led into that state.
 */
public final class TransitionTable {

    private static final Map<RunState, Map<RunEvent, RunState>> TABLE = new EnumMap<>(RunState.class);

    static {
        // Normal flow
        add(CREATED, START_PARSING, PARSING);
        add(PARSING, PARSING_COMPLETE, GENERATING);
        add(GENERATING, GENERATION_COMPLETE, AWAITING_APPROVAL);
        add(AWAITING_APPROVAL, APPROVED, EXECUTING);
        add(AWAITING_APPROVAL, REJECTED, GENERATING);
        add(EXECUTING, EXECUTION_COMPLETE, CODEX_REVIEWING);
        add(CODEX_REVIEWING, REVIEW_COMPLETE, CROSS_VALIDATING);
        add(CROSS_VALIDATING, VALIDATION_COMPLETE, REPORT_READY);
        add(REPORT_READY, CONFIRMED, COMPLETED);
        add(REPORT_READY, RETEST, CREATED);

        // Errors from working states
        for (RunState state : List.of(PARSING, GENERATING, EXECUTING, CODEX_REVIEWING, CROSS_VALIDATING)) {
            add(state, ERROR, FAILED);
        }

        // Timeouts from agent-bound and human-gate states
        for (RunState state : List.of(PARSING, GENERATING, EXECUTING, CODEX_REVIEWING,
                AWAITING_APPROVAL, REPORT_READY)) {
            add(state, TIMEOUT, FAILED);
        }

        // Late duplicates
        add(PARSING, START_PARSING, PARSING);
        add(GENERATING, PARSING_COMPLETE, GENERATING);
        add(AWAITING_APPROVAL, GENERATION_COMPLETE, AWAITING_APPROVAL);
        add(EXECUTING, APPROVED, EXECUTING);
        add(CODEX_REVIEWING, EXECUTION_COMPLETE, CODEX_REVIEWING);
        add(CROSS_VALIDATING, REVIEW_COMPLETE, CROSS_VALIDATING);
        add(REPORT_READY, VALIDATION_COMPLETE, REPORT_READY);
    }

    private TransitionTable() {}

    private static void add(RunState from, RunEvent event, RunState to) {
        TABLE.computeIfAbsent(from, k -> new EnumMap<>(RunEvent.class)).put(event, to);
    }

    public static boolean isTerminal(RunState state) {
        return state.isTerminal();
    }

    /**
     * Target of {@code (state, event)}, or empty if the pair is not in the table.
     */
    public static Optional<RunState> targetState(RunState state, RunEvent event) {
        Map<RunEvent, RunState> row = TABLE.get(state);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(event));
    }

    public static boolean isValidTransition(RunState state, RunEvent event) {
        return targetState(state, event).isPresent();
    }

    /**
     * Events accepted in {@code state}, in declaration order.
     */
    public static List<RunEvent> validEvents(RunState state) {
        Map<RunEvent, RunState> row = TABLE.get(state);
        return row == null ? List.of() : List.copyOf(row.keySet());
    }

    /**
     * Read-only view of the whole table.
     */
    public static Map<RunState, Map<RunEvent, RunState>> entries() {
        Map<RunState, Map<RunEvent, RunState>> copy = new EnumMap<>(RunState.class);
        TABLE.forEach((state, row) -> copy.put(state, Collections.unmodifiableMap(row)));
        return Collections.unmodifiableMap(copy);
    }
}

package com.smarttest.core.engine;

import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.TestRun;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Human-gate deadlines, computed purely from persisted decision-log timestamps.
 */
public final class GateTimeouts {

    public static final Duration APPROVAL_SLA = Duration.ofHours(24);
    public static final Duration CONFIRMATION_SLA = Duration.ofHours(48);

    private GateTimeouts() {}

    /**
     * When the current visit to {@code gateState} expires: the most recent entry into the state
     * plus {@code sla}. Empty if the run never entered the state.
     */
    public static Optional<Instant> deadline(TestRun run, RunState gateState, Duration sla) {
        return run.lastEntryInto(gateState)
                .map(DecisionLogEntry::timestamp)
                .map(entered -> entered.plus(sla));
    }

    public static boolean hasTimedOut(TestRun run, RunState gateState, Duration sla, Instant now) {
        return deadline(run, gateState, sla)
                .map(deadline -> !now.isBefore(deadline))
                .orElse(false);
    }

    public static Duration slaFor(RunState gateState) {
        return switch (gateState) {
            case AWAITING_APPROVAL -> APPROVAL_SLA;
            case REPORT_READY -> CONFIRMATION_SLA;
            default -> throw new IllegalArgumentException(gateState.wireName() + " is not a human gate");
        };
    }
}

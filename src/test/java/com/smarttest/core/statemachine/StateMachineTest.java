package com.smarttest.core.statemachine;

import com.smarttest.core.engine.RunContext;
import com.smarttest.core.model.RunEvent;
import com.smarttest.core.model.RunState;
import com.smarttest.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static com.smarttest.core.model.RunEvent.*;
import static com.smarttest.core.model.RunState.*;
import static org.junit.jupiter.api.Assertions.*;

class StateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private MutableClock clock;
    private StateMachine stateMachine;
    private RunContext context;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        stateMachine = new StateMachine(clock);
        context = new RunContext("run-1");
    }

    /**
     * Transitions and records the applied key, as the orchestrator does once the run is stored.
     */
    private TransitionResult apply(RunContext ctx, RunState state, RunEvent event, String shardId) {
        var result = stateMachine.transition(ctx, state, event, shardId, null, null);
        if (result.success() && !result.isNoOp()) {
            ctx.recordApplied(result.key(), result.newState());
        }
        return result;
    }

    private TransitionResult apply(RunState state, RunEvent event) {
        return apply(context, state, event, null);
    }

    @Nested
    @DisplayName("Applied transitions")
    class Applied {

        @Test
        @DisplayName("returns the target state and a log entry")
        void appliesTableEntry() {
            TransitionResult result = stateMachine.transition(context, CREATED, START_PARSING, null,
                    "go", Map.of("by", "scheduler"));

            assertTrue(result.success());
            assertFalse(result.isNoOp());
            assertEquals(PARSING, result.newState());
            assertNull(result.error());

            var entry = result.logEntry();
            assertEquals(T0, entry.timestamp());
            assertEquals(CREATED, entry.fromState());
            assertEquals(PARSING, entry.toState());
            assertEquals(START_PARSING, entry.event());
            assertEquals("go", entry.reason());
            assertEquals("scheduler", entry.metadata().get("by"));
        }

        @Test
        @DisplayName("log entry is stamped with the clock")
        void usesClock() {
            clock.advance(Duration.ofMinutes(5));
            var result = stateMachine.transition(context, CREATED, START_PARSING);
            assertEquals(T0.plus(Duration.ofMinutes(5)), result.logEntry().timestamp());
        }

        @Test
        @DisplayName("carries the idempotency key and leaves the context untouched")
        void keyIsReturnedNotRecorded() {
            var result = stateMachine.transition(context, CREATED, START_PARSING, "shard-a", null, null);

            assertEquals(new IdempotencyKey("run-1", CREATED, START_PARSING, "shard-a"), result.key());
            assertEquals(0, context.appliedKeyCount());
        }

        @Test
        @DisplayName("an applied result that was never recorded is applied again")
        void unrecordedIsNotADuplicate() {
            stateMachine.transition(context, CREATED, START_PARSING);
            var again = stateMachine.transition(context, CREATED, START_PARSING);

            assertFalse(again.isNoOp());
            assertEquals(PARSING, again.newState());
            assertNotNull(again.logEntry());
        }

        @Test
        @DisplayName("null metadata values are dropped from the log entry")
        void nullMetadataValues() {
            var metadata = new HashMap<String, Object>();
            metadata.put("shard", null);
            metadata.put("by", "scheduler");

            var result = stateMachine.transition(context, CREATED, START_PARSING, null, null, metadata);

            assertEquals(Map.of("by", "scheduler"), result.logEntry().metadata());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("events outside the table are rejected without a log entry")
        void illegalEvent() {
            var result = stateMachine.transition(context, CREATED, APPROVED);

            assertFalse(result.success());
            assertEquals(CREATED, result.newState());
            assertNull(result.logEntry());
            assertTrue(result.error().contains("Invalid transition"));
        }

        @Test
        @DisplayName("terminal states reject everything")
        void terminal() {
            var result = stateMachine.transition(context, FAILED, APPROVED);

            assertFalse(result.success());
            assertEquals(FAILED, result.newState());
            assertTrue(result.error().contains("terminal"));
        }

        @Test
        @DisplayName("approval after a timeout is rejected")
        void lateApproval() {
            var timeout = stateMachine.transition(context, AWAITING_APPROVAL, TIMEOUT);
            assertEquals(FAILED, timeout.newState());

            var approval = stateMachine.transition(context, timeout.newState(), APPROVED);
            assertFalse(approval.success());
            assertEquals(FAILED, approval.newState());
        }

        @Test
        @DisplayName("rejections do not record idempotency keys")
        void rejectedKeysAreNotRecorded() {
            stateMachine.transition(context, CREATED, APPROVED);
            assertEquals(0, context.appliedKeyCount());
        }
    }

    @Nested
    @DisplayName("Duplicate suppression")
    class Duplicates {

        @Test
        @DisplayName("replaying the same event in the same state is a no-op")
        void replay() {
            var first = apply(GENERATING, GENERATION_COMPLETE);
            var second = apply(GENERATING, GENERATION_COMPLETE);

            assertTrue(second.success());
            assertTrue(second.isNoOp());
            assertEquals(first.newState(), second.newState());
            assertNull(second.logEntry());
        }

        @Test
        @DisplayName("a late duplicate in the next state is a self-loop no-op")
        void lateDuplicate() {
            apply(GENERATING, GENERATION_COMPLETE);
            var late = apply(AWAITING_APPROVAL, GENERATION_COMPLETE);

            assertTrue(late.isNoOp());
            assertEquals(AWAITING_APPROVAL, late.newState());
            assertNull(late.logEntry());
        }

        @Test
        @DisplayName("different shards of the same event are applied separately")
        void shards() {
            var a = apply(context, EXECUTING, EXECUTION_COMPLETE, "shard-a");
            var b = apply(context, EXECUTING, EXECUTION_COMPLETE, "shard-b");

            assertFalse(a.isNoOp());
            assertFalse(b.isNoOp());
        }

        @Test
        @DisplayName("contexts of different runs do not share keys")
        void runsAreIsolated() {
            apply(CREATED, START_PARSING);
            var other = apply(new RunContext("run-2"), CREATED, START_PARSING, null);
            assertFalse(other.isNoOp());
        }
    }

    @Nested
    @DisplayName("Re-entered states")
    class Loops {

        @Test
        @DisplayName("rejection loop lets generation complete again")
        void rejectionLoop() {
            var toApproval = apply(GENERATING, GENERATION_COMPLETE);
            assertEquals(AWAITING_APPROVAL, toApproval.newState());

            var rejected = apply(AWAITING_APPROVAL, REJECTED);
            assertEquals(GENERATING, rejected.newState());

            var again = apply(GENERATING, GENERATION_COMPLETE);
            assertFalse(again.isNoOp());
            assertNotNull(again.logEntry());
            assertEquals(AWAITING_APPROVAL, again.newState());
        }

        @Test
        @DisplayName("retest loop lets parsing start again")
        void retestLoop() {
            RunState state = CREATED;
            for (var event : new RunEvent[]{START_PARSING, PARSING_COMPLETE,
                    GENERATION_COMPLETE, APPROVED, EXECUTION_COMPLETE, REVIEW_COMPLETE, VALIDATION_COMPLETE, RETEST}) {
                var result = apply(state, event);
                assertFalse(result.isNoOp(), event.name());
                state = result.newState();
            }
            assertEquals(CREATED, state);

            var restart = apply(CREATED, START_PARSING);
            assertFalse(restart.isNoOp());
            assertEquals(PARSING, restart.newState());
        }
    }
}

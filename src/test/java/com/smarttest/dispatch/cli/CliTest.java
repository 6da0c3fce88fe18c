package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.engine.TransitionException;
import com.smarttest.core.health.HealthCheckService;
import com.smarttest.core.health.HealthStatus;
import com.smarttest.core.model.*;
import com.smarttest.core.persistence.StaleRunException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the SmartTest CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final String RUN_ID = "6f1c2a7e-0000-4000-8000-000000000001";

    private record CliResult(int exitCode, String output) {}

    private Orchestrator orchestrator;
    private HealthCheckService healthCheckService;
    private final Clock clock = Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("repository", HealthStatus.Status.UP, "Run repository reachable",
                        Map.of("type", "InMemoryRunRepository")),
                new HealthStatus("database", HealthStatus.Status.DEGRADED,
                        "No DataSource configured; runs are kept in memory", Map.of()),
                new HealthStatus("workspace", HealthStatus.Status.UP, "Workspace root writable", Map.of())));
    }

    private static TestRun run(String id, RunState state, ReasonCode reason, List<DecisionLogEntry> log) {
        return new TestRun(id, "shop", state, reason, "docs/prd.md", List.of("/login", "/cart"),
                "ws/" + id, Map.of(), Map.of(), Map.of(), log, null, null, T0, T0, null);
    }

    private static TestRun awaitingApproval() {
        return run(RUN_ID, RunState.AWAITING_APPROVAL, null, List.of(
                new DecisionLogEntry(T0, RunState.CREATED, RunState.CREATED, RunEvent.RUN_CREATED,
                        "Test run created", Map.of()),
                new DecisionLogEntry(T0, RunState.CREATED, RunState.PARSING, RunEvent.START_PARSING, null, Map.of()),
                new DecisionLogEntry(T0, RunState.PARSING, RunState.GENERATING, RunEvent.PARSING_COMPLETE,
                        null, Map.of()),
                new DecisionLogEntry(T0, RunState.GENERATING, RunState.AWAITING_APPROVAL,
                        RunEvent.GENERATION_COMPLETE, "14 test cases generated", Map.of())));
    }

    private CommandLine.IFactory createFactory(HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(orchestrator);
                }
                if (cls == TimelineCommand.class) {
                    return (K) new TimelineCommand(orchestrator);
                }
                if (cls == HistoryCommand.class) {
                    return (K) new HistoryCommand(orchestrator);
                }
                if (cls == ApproveCommand.class) {
                    return (K) new ApproveCommand(orchestrator, clock);
                }
                if (cls == ConfirmCommand.class) {
                    return (K) new ConfirmCommand(orchestrator, clock);
                }
                if (cls == CheckTimeoutsCommand.class) {
                    return (K) new CheckTimeoutsCommand(orchestrator);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(healthCheckService, args);
    }

    private CliResult execute(HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new SmartTestCommand(), createFactory(health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("status", "timeline", "history", "approve", "confirm",
                    "check-timeouts", "health", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SmartTest 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void bareCommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SMARTTEST v0.1.0"));
            assertTrue(result.output().contains("Usage: smarttest"));
        }

        @Test
        @DisplayName("approve --help shows reviewer and reject options")
        void approveHelp() {
            CliResult result = execute("approve", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Approve or reject generated test cases"));
            assertTrue(result.output().contains("--reviewer"));
            assertTrue(result.output().contains("--reject"));
        }

        @Test
        @DisplayName("history --help shows filter options")
        void historyHelp() {
            CliResult result = execute("history", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--limit"));
            assertTrue(result.output().contains("--project"));
            assertTrue(result.output().contains("--state"));
        }
    }

    @Nested
    @DisplayName("Status and timeline")
    class StatusTests {

        @Test
        @DisplayName("status shows state, routes and approval deadline")
        void statusOfWaitingRun() {
            when(orchestrator.getRun(RUN_ID)).thenReturn(awaitingApproval());

            CliResult result = execute("status", RUN_ID);

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("RUN " + RUN_ID));
            assertTrue(result.output().contains("/login, /cart"));
            assertTrue(result.output().contains("State: awaiting_approval"));
            assertTrue(result.output().contains("Decision due by 2026-03-02T09:00:00Z"));
        }

        @Test
        @DisplayName("status of a failed run shows its reason")
        void statusOfFailedRun() {
            when(orchestrator.getRun(RUN_ID)).thenReturn(
                    run(RUN_ID, RunState.FAILED, ReasonCode.APPROVAL_TIMEOUT, List.of()));

            CliResult result = execute("status", RUN_ID);

            assertTrue(result.output().contains("Reason: approval_timeout"));
        }

        @Test
        @DisplayName("unknown run prints an error")
        void unknownRun() {
            when(orchestrator.getRun("nope")).thenThrow(NotFoundException.run("nope"));

            CliResult result = execute("status", "nope");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Test run not found: nope"));
        }

        @Test
        @DisplayName("timeline lists every decision log entry")
        void timeline() {
            when(orchestrator.getRun(RUN_ID)).thenReturn(awaitingApproval());

            CliResult result = execute("timeline", RUN_ID);

            assertTrue(result.output().contains("GENERATION_COMPLETE"));
            assertTrue(result.output().contains("14 test cases generated"));
            assertTrue(result.output().contains("4 entries recorded."));
        }
    }

    @Nested
    @DisplayName("History")
    class HistoryTests {

        @Test
        @DisplayName("no runs -> informative message")
        void empty() {
            when(orchestrator.getRecentRuns(10)).thenReturn(List.of());

            CliResult result = execute("history");

            assertTrue(result.output().contains("No test runs found."));
        }

        @Test
        @DisplayName("--state filters by wire name")
        void byState() {
            when(orchestrator.getRunsByState(RunState.AWAITING_APPROVAL)).thenReturn(List.of(awaitingApproval()));

            CliResult result = execute("history", "--state", "awaiting_approval");

            assertTrue(result.output().contains(RUN_ID));
            assertTrue(result.output().contains("Test runs (1 of 1)"));
        }

        @Test
        @DisplayName("unknown state is reported")
        void unknownState() {
            CliResult result = execute("history", "-s", "sleeping");

            assertTrue(result.output().contains("Unknown run state: sleeping"));
            verify(orchestrator, never()).getRunsByState(any());
        }

        @Test
        @DisplayName("--limit trims the listing")
        void limit() {
            when(orchestrator.getRunsForProject("shop")).thenReturn(List.of(
                    run("run-a", RunState.COMPLETED, null, List.of()),
                    run("run-b", RunState.FAILED, ReasonCode.PLAYWRIGHT_ERROR, List.of())));

            CliResult result = execute("history", "-p", "shop", "-n", "1");

            assertTrue(result.output().contains("Test runs (1 of 2)"));
            assertTrue(result.output().contains("run-a"));
            assertFalse(result.output().contains("run-b"));
        }
    }

    @Nested
    @DisplayName("Human gates")
    class GateTests {

        @Test
        @DisplayName("approve passes reviewer and comments to the orchestrator")
        void approve() {
            when(orchestrator.handleApproval(any(), any()))
                    .thenReturn(run(RUN_ID, RunState.EXECUTING, null, List.of()));

            CliResult result = execute("approve", RUN_ID, "-r", "alice", "-c", "looks good");

            var captor = ArgumentCaptor.forClass(ApprovalDecision.class);
            verify(orchestrator).handleApproval(any(), captor.capture());
            assertTrue(captor.getValue().approved());
            assertEquals("alice", captor.getValue().reviewerId());
            assertEquals("looks good", captor.getValue().comments());
            assertEquals(clock.instant(), captor.getValue().timestamp());
            assertTrue(result.output().contains("Approved run " + RUN_ID));
            assertTrue(result.output().contains("State: executing"));
        }

        @Test
        @DisplayName("approve without --reviewer is a usage error")
        void approveNeedsReviewer() {
            CliResult result = execute("approve", RUN_ID);

            assertNotEquals(0, result.exitCode());
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("rejected transition is reported, not thrown")
        void approveWrongState() {
            when(orchestrator.handleApproval(any(), any())).thenThrow(new TransitionException(RUN_ID,
                    RunState.FAILED, RunEvent.REJECTED, "Run is in terminal state failed"));

            CliResult result = execute("approve", RUN_ID, "-r", "bob", "--reject");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run is in terminal state failed"));
        }

        @Test
        @DisplayName("a write lost to a concurrent update exits with the storage failure code")
        void approveStaleWrite() {
            when(orchestrator.handleApproval(any(), any())).thenThrow(new StaleRunException(RUN_ID, 4));

            CliResult result = execute("approve", RUN_ID, "-r", "bob");

            assertEquals(CliRunner.EXIT_STORAGE_FAILURE, result.exitCode());
            assertTrue(result.output().contains("Storage error: Run " + RUN_ID + " was modified concurrently"));
        }

        @Test
        @DisplayName("unexpected failures keep picocli's default exit code")
        void approveUnexpected() {
            when(orchestrator.handleApproval(any(), any())).thenThrow(new IllegalStateException("boom"));

            CliResult result = execute("approve", RUN_ID, "-r", "bob");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("boom"));
        }

        @Test
        @DisplayName("confirm --retest asks for a retest")
        void retest() {
            when(orchestrator.handleConfirmation(any(), any()))
                    .thenReturn(run(RUN_ID, RunState.CREATED, null, List.of()));

            CliResult result = execute("confirm", RUN_ID, "-r", "carol", "--retest");

            var captor = ArgumentCaptor.forClass(ConfirmationDecision.class);
            verify(orchestrator).handleConfirmation(any(), captor.capture());
            assertFalse(captor.getValue().confirmed());
            assertTrue(captor.getValue().retest());
            assertTrue(result.output().contains("Retest requested for run " + RUN_ID));
        }
    }

    @Nested
    @DisplayName("Timeouts and health")
    class MaintenanceTests {

        @Test
        @DisplayName("check-timeouts lists runs that were failed")
        void timeouts() {
            when(orchestrator.checkAllTimeouts()).thenReturn(List.of(
                    run("run-a", RunState.FAILED, ReasonCode.CONFIRM_TIMEOUT, List.of())));

            CliResult result = execute("check-timeouts");

            assertTrue(result.output().contains("Run run-a timed out (confirm_timeout)"));
            assertTrue(result.output().contains("1 run failed."));
        }

        @Test
        @DisplayName("check-timeouts with nothing expired")
        void noTimeouts() {
            when(orchestrator.checkAllTimeouts()).thenReturn(List.of());

            CliResult result = execute("check-timeouts");

            assertTrue(result.output().contains("No expired approval or confirmation windows."));
        }

        @Test
        @DisplayName("health prints each component and a degraded overall status")
        void health() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("repository: Run repository reachable [type=InMemoryRunRepository]"));
            assertTrue(result.output().contains("database: No DataSource configured"));
            assertTrue(result.output().contains("Overall: usable, 1 component(s) degraded"));
        }

        @Test
        @DisplayName("health without a service reports it unavailable")
        void healthUnavailable() {
            CliResult result = execute((HealthCheckService) null, "health");

            assertTrue(result.output().contains("Health check service not available"));
        }

        @Test
        @DisplayName("health with a component down reports it")
        void healthDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("database", HealthStatus.Status.DOWN, "Database error: refused", Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("Overall: 1 component(s) down"));
        }
    }
}

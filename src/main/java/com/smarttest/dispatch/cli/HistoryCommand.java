package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: smarttest history
 * <p>
 * Lists test runs, optionally filtered by project or state: Run ID | State | Reason | Project | Created.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List test runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--project", "-p"}, description = "Only runs of this project")
    private String projectId;

    @Option(names = {"--state", "-s"}, description = "Only runs in this state (e.g. awaiting_approval)")
    private String state;

    private final Orchestrator orchestrator;

    public HistoryCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<TestRun> runs;
        try {
            runs = select();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (runs.isEmpty()) {
            ConsoleOutput.info("No test runs found.");
            return;
        }

        List<TestRun> display = runs.size() > limit ? runs.subList(0, limit) : runs;

        ConsoleOutput.info("Test runs (" + display.size() + " of " + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-38s %-18s %-18s %-16s %s%n", "RUN ID", "STATE", "REASON", "PROJECT", "CREATED");
        System.out.println("  " + "-".repeat(116));
        for (TestRun run : display) {
            System.out.printf("  %-38s %-18s %-18s %-16s %s%n",
                    run.id(),
                    run.state().wireName(),
                    run.reasonCode() != null ? run.reasonCode().wireName() : "-",
                    ConsoleOutput.truncate(run.projectId(), 16),
                    run.createdAt());
        }
    }

    private List<TestRun> select() {
        if (state != null) {
            RunState filter = RunState.fromWireName(state);
            return orchestrator.getRunsByState(filter).stream()
                    .filter(r -> projectId == null || projectId.equals(r.projectId()))
                    .toList();
        }
        if (projectId != null) {
            return orchestrator.getRunsForProject(projectId);
        }
        return orchestrator.getRecentRuns(limit);
    }
}

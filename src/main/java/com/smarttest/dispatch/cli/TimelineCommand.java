package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: smarttest timeline &lt;run-id&gt;
 * <p>
 * Prints the run's decision log in chronological order.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show the decision log of a test run")
@Component
public class TimelineCommand implements Runnable {

    @Parameters(index = "0", description = "Test run ID")
    private String runId;

    private final Orchestrator orchestrator;

    public TimelineCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        TestRun run;
        try {
            run = orchestrator.getRun(runId);
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        ConsoleOutput.info("Timeline for run " + runId);
        System.out.println();
        System.out.printf("  %-4s %-28s %-18s %-18s %-20s %s%n", "#", "TIME", "FROM", "TO", "EVENT", "REASON");
        System.out.println("  " + "-".repeat(110));

        int step = 1;
        for (DecisionLogEntry entry : run.decisionLog()) {
            System.out.printf("  %-4d %-28s %-18s %-18s %-20s %s%n", step++,
                    entry.timestamp(), entry.fromState().wireName(), entry.toState().wireName(),
                    entry.event(), ConsoleOutput.truncate(entry.reason(), 40));
        }

        System.out.println();
        int size = run.decisionLog().size();
        ConsoleOutput.info(size + " entr" + (size != 1 ? "ies" : "y") + " recorded.");
    }
}

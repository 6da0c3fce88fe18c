package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.GateTimeouts;
import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: smarttest status &lt;run-id&gt;
 * <p>
 * Shows the current state of a run, its failure reason, pending gate deadline and quality metrics.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show test run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Test run ID")
    private String runId;

    private final Orchestrator orchestrator;

    public StatusCommand(Orchestrator orchestrator) {
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

        System.out.println();
        System.out.println("RUN " + run.id());
        System.out.println("Project: " + run.projectId());
        System.out.println("PRD: " + run.prdPath());
        System.out.println("Routes: " + (run.testedRoutes().isEmpty() ? "-" : String.join(", ", run.testedRoutes())));
        ConsoleOutput.state(run.state());

        if (run.reasonCode() != null) {
            ConsoleOutput.error("Reason: " + run.reasonCode().wireName());
        }
        if (run.state() == RunState.AWAITING_APPROVAL || run.state() == RunState.REPORT_READY) {
            GateTimeouts.deadline(run, run.state(), GateTimeouts.slaFor(run.state()))
                    .ifPresent(deadline -> ConsoleOutput.info("Decision due by " + deadline));
        }
        if (run.qualityMetrics() != null) {
            System.out.println();
            System.out.println("Quality metrics:");
            ConsoleOutput.metric(run.qualityMetrics().rc());
            ConsoleOutput.metric(run.qualityMetrics().apr());
            ConsoleOutput.metric(run.qualityMetrics().fr());
        }
        if (run.reportPath() != null) {
            ConsoleOutput.info("Report: " + run.reportPath());
        }
        System.out.println();
        ConsoleOutput.info("Created " + run.createdAt() + ", updated " + run.updatedAt()
                + (run.completedAt() != null ? ", completed " + run.completedAt() : ""));
    }
}

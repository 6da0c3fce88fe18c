package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.RunContext;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.engine.TransitionException;
import com.smarttest.core.engine.ValidationException;
import com.smarttest.core.model.ConfirmationDecision;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;

/**
 * CLI command: smarttest confirm &lt;run-id&gt; --reviewer &lt;id&gt; [--retest] [--comments ...]
 * <p>
 * Confirms the report of a run, completing it, or sends the run back for a retest.
 */
@Command(name = "confirm", mixinStandardHelpOptions = true, description = "Confirm a report or request a retest")
@Component
public class ConfirmCommand implements Runnable {

    @Parameters(index = "0", description = "Test run ID")
    private String runId;

    @Option(names = {"--reviewer", "-r"}, required = true, description = "Reviewer ID")
    private String reviewerId;

    @Option(names = "--retest", description = "Request a retest instead of confirming")
    private boolean retest;

    @Option(names = {"--comments", "-c"}, description = "Reviewer comments")
    private String comments;

    private final Orchestrator orchestrator;
    private final Clock clock;

    public ConfirmCommand(Orchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var decision = new ConfirmationDecision(!retest, retest, reviewerId, comments, clock.instant());
        try {
            TestRun run = orchestrator.handleConfirmation(new RunContext(runId), decision);
            ConsoleOutput.success((retest ? "Retest requested for" : "Confirmed") + " run " + runId);
            ConsoleOutput.state(run.state());
        } catch (NotFoundException | TransitionException | ValidationException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}

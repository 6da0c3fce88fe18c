package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.engine.RunContext;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.engine.TransitionException;
import com.smarttest.core.model.ApprovalDecision;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;

/**
 * CLI command: smarttest approve &lt;run-id&gt; --reviewer &lt;id&gt; [--reject] [--comments ...]
 * <p>
 * Approves the generated test cases of a run, or rejects them for regeneration.
 */
@Command(name = "approve", mixinStandardHelpOptions = true, description = "Approve or reject generated test cases")
@Component
public class ApproveCommand implements Runnable {

    @Parameters(index = "0", description = "Test run ID")
    private String runId;

    @Option(names = {"--reviewer", "-r"}, required = true, description = "Reviewer ID")
    private String reviewerId;

    @Option(names = "--reject", description = "Reject the test cases instead of approving them")
    private boolean reject;

    @Option(names = {"--comments", "-c"}, description = "Reviewer comments")
    private String comments;

    private final Orchestrator orchestrator;
    private final Clock clock;

    public ApproveCommand(Orchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var decision = new ApprovalDecision(!reject, reviewerId, comments, clock.instant());
        try {
            TestRun run = orchestrator.handleApproval(new RunContext(runId), decision);
            ConsoleOutput.success((reject ? "Rejected" : "Approved") + " run " + runId
                    + " by " + reviewerId);
            ConsoleOutput.state(run.state());
        } catch (NotFoundException | TransitionException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}

package com.smarttest.dispatch.cli;

import com.smarttest.core.engine.Orchestrator;
import com.smarttest.core.model.TestRun;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: smarttest check-timeouts
 * <p>
 * Fails every run whose approval (24h) or report confirmation (48h) window has elapsed.
 * Intended to be run periodically.
 */
@Command(name = "check-timeouts", mixinStandardHelpOptions = true,
        description = "Fail runs whose approval or confirmation window has expired")
@Component
public class CheckTimeoutsCommand implements Runnable {

    private final Orchestrator orchestrator;

    public CheckTimeoutsCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<TestRun> timedOut = orchestrator.checkAllTimeouts();
        if (timedOut.isEmpty()) {
            ConsoleOutput.success("No expired approval or confirmation windows.");
            return;
        }
        for (TestRun run : timedOut) {
            ConsoleOutput.error("Run " + run.id() + " timed out ("
                    + (run.reasonCode() != null ? run.reasonCode().wireName() : "unknown") + ")");
        }
        ConsoleOutput.info(timedOut.size() + " run" + (timedOut.size() != 1 ? "s" : "") + " failed.");
    }
}

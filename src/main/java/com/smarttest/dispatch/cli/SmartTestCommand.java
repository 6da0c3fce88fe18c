package com.smarttest.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: status, timeline, history, approve, confirm, check-timeouts, health.
 */
@Command(
        name = "smarttest",
        mixinStandardHelpOptions = true,
        version = "SmartTest 0.1.0",
        description = "Lifecycle, approval gates and quality gate for AI-assisted UI test runs",
        subcommands = {
                StatusCommand.class,
                TimelineCommand.class,
                HistoryCommand.class,
                ApproveCommand.class,
                ConfirmCommand.class,
                CheckTimeoutsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SmartTestCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

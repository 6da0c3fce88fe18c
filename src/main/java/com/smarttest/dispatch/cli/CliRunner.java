package com.smarttest.dispatch.cli;

import com.smarttest.core.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * <p>
 * Commands report domain errors (unknown run, illegal transition) themselves. Storage failures
 * escape them and end the process with {@link #EXIT_STORAGE_FAILURE}; a stale write can be
 * retried by running the command again.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_STORAGE_FAILURE = 3;

    private final SmartTestCommand smartTestCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SmartTestCommand smartTestCommand, IFactory factory) {
        this.smartTestCommand = smartTestCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(smartTestCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(SmartTestCommand root, IFactory factory) {
        var commandLine = new CommandLine(root, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof PersistenceException) {
                log.error("Command '{}' failed on storage: {}", cmd.getCommandName(), ex.getMessage(), ex);
                ConsoleOutput.error("Storage error: " + ex.getMessage());
                return EXIT_STORAGE_FAILURE;
            }
            throw ex;
        });
        return commandLine;
    }
}

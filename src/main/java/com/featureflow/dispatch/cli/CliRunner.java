package com.featureflow.dispatch.cli;

import com.featureflow.core.error.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.LinkedHashMap;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    /** Exit code for failures outside the workflow error taxonomy. */
    static final int UNEXPECTED_ERROR = 1;

    private final FeatureflowCommand featureflowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FeatureflowCommand featureflowCommand, IFactory factory) {
        this.featureflowCommand = featureflowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = configure(new CommandLine(featureflowCommand, factory)).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Applies the shared CLI conventions: case-insensitive enum values, usage errors
     * mapped to exit code 2, workflow errors mapped to their exit codes and reported
     * without a stack trace.
     */
    static CommandLine configure(CommandLine commandLine) {
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExitCodeExceptionMapper(CliRunner::exitCodeFor);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            boolean json = parseResult != null && parseResult.subcommand() != null
                    ? parseResult.subcommand().hasMatchedOption("--json")
                    : parseResult != null && parseResult.hasMatchedOption("--json");
            if (ex instanceof CommandLine.ParameterException usageError) {
                String[] args = parseResult != null ? parseResult.originalArgs().toArray(new String[0]) : new String[0];
                return usageError.getCommandLine().getParameterExceptionHandler().handleParseException(usageError, args);
            }
            if (ex instanceof WorkflowException workflowError) {
                log.debug("Command failed with {}", workflowError.kind(), ex);
                if (json) {
                    var body = new LinkedHashMap<String, Object>();
                    body.put("error", workflowError.kind().name());
                    body.put("exitCode", workflowError.exitCode());
                    body.put("message", workflowError.getMessage());
                    ConsoleOutput.json(body);
                } else {
                    ConsoleOutput.error(workflowError.getMessage());
                }
            } else {
                log.error("Unexpected failure", ex);
                ConsoleOutput.error(ex.getClass().getSimpleName() + ": " + ex.getMessage());
            }
            return exitCodeFor(ex);
        });
        return commandLine;
    }

    static int exitCodeFor(Throwable ex) {
        if (ex instanceof CommandLine.ParameterException) {
            return CommandLine.ExitCode.USAGE;
        }
        return ex instanceof WorkflowException workflowError ? workflowError.exitCode() : UNEXPECTED_ERROR;
    }
}

package com.featureflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Featureflow.
 */
@Command(
        name = "featureflow",
        mixinStandardHelpOptions = true,
        version = "Featureflow 0.1.0",
        description = "Specification-first feature workflow: numbering, artifacts, gates and resumable phases",
        subcommands = {
                CreateFeatureCommand.class,
                PathsCommand.class,
                CheckCommand.class,
                TasksCommand.class,
                StartCommand.class,
                ResumeCommand.class,
                SkipCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FeatureflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}

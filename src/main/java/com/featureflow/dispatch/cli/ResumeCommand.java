package com.featureflow.dispatch.cli;

import com.featureflow.core.engine.PhaseOrchestrator;
import com.featureflow.core.engine.WorkflowRun;
import com.featureflow.core.events.EventBus;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.model.WorkflowMode;
import com.featureflow.core.registry.RepositoryContextResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: featureflow resume [--continue]
 * <p>
 * Picks the saved workflow back up. A failed phase is retried; a paused one runs
 * only with {@code --continue}.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume the saved workflow")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Option(names = {"--continue", "-c"}, description = "Confirm the paused phase and run it")
    private boolean continueSignal;

    @Option(names = {"--mode", "-m"}, description = "Switch to another mode from here on: ${COMPLETION-CANDIDATES}")
    private WorkflowMode mode;

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final PhaseOrchestrator orchestrator;
    private final EventBus eventBus;

    public ResumeCommand(RepositoryContextResolver contextResolver, PhaseOrchestrator orchestrator,
                         EventBus eventBus) {
        this.contextResolver = contextResolver;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        if (!options.json) {
            ConsoleOutput.printBanner();
        }
        WorkflowRun run;
        try (var subscription = options.json ? null : eventBus.subscribeAll(ConsoleOutput::event)) {
            run = orchestrator.resume(context, mode, continueSignal);
        }
        if (options.json) {
            ConsoleOutput.json(run);
        } else {
            ConsoleOutput.runResult(run);
        }
        return run.exitCode();
    }
}

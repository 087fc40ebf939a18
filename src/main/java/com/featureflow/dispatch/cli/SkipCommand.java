package com.featureflow.dispatch.cli;

import com.featureflow.core.engine.PhaseOrchestrator;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.registry.RepositoryContextResolver;
import com.featureflow.core.state.WorkflowState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: featureflow skip &lt;phase&gt;
 */
@Command(name = "skip", mixinStandardHelpOptions = true, description = "Skip an optional phase (clarify or analyze)")
@Component
public class SkipCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<phase>", description = "Phase to skip")
    private Phase phase;

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final PhaseOrchestrator orchestrator;

    public SkipCommand(RepositoryContextResolver contextResolver, PhaseOrchestrator orchestrator) {
        this.contextResolver = contextResolver;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        WorkflowState state = orchestrator.skip(context, phase);
        if (options.json) {
            ConsoleOutput.json(state);
        } else {
            ConsoleOutput.success("Skipped " + phase.id() + " for " + state.featureId());
            ConsoleOutput.field("Current phase", state.currentPhase().id());
        }
        return 0;
    }
}

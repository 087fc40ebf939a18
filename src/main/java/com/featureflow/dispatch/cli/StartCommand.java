package com.featureflow.dispatch.cli;

import com.featureflow.core.engine.PhaseOrchestrator;
import com.featureflow.core.engine.WorkflowRun;
import com.featureflow.core.events.EventBus;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.model.WorkflowMode;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.registry.RepositoryContextResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow start [description...]
 * <p>
 * With a description, allocates a new feature and starts its workflow. Without one,
 * starts the workflow for the current feature (e.g. one made with create-feature).
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start the phase workflow for a feature")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "<description>",
            description = "Description of a new feature; omit to use the current feature")
    private List<String> description;

    @Option(names = {"--mode", "-m"}, defaultValue = "interactive",
            description = "Workflow mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private WorkflowMode mode;

    @Option(names = "--short-name", paramLabel = "<name>", description = "Explicit short name for a new feature")
    private String shortName;

    @Option(names = "--skip", split = ",", paramLabel = "<phase>", description = "Optional phases to skip: clarify, analyze")
    private List<Phase> skip;

    @Option(names = {"--continue", "-c"}, description = "Run the first phase without pausing for confirmation")
    private boolean continueSignal;

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final FeatureRegistry registry;
    private final PhaseOrchestrator orchestrator;
    private final EventBus eventBus;

    public StartCommand(RepositoryContextResolver contextResolver, FeatureRegistry registry,
                        PhaseOrchestrator orchestrator, EventBus eventBus) {
        this.contextResolver = contextResolver;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        Set<Phase> skipped = skip == null || skip.isEmpty() ? Set.of() : EnumSet.copyOf(skip);

        if (!options.json) {
            ConsoleOutput.printBanner();
        }
        WorkflowRun run;
        try (var subscription = options.json ? null : eventBus.subscribeAll(ConsoleOutput::event)) {
            run = description == null || description.isEmpty()
                    ? orchestrator.begin(context, registry.resolveCurrent(context), mode, skipped, continueSignal)
                    : orchestrator.start(context, String.join(" ", description), shortName, mode, skipped,
                            continueSignal);
        }
        if (options.json) {
            ConsoleOutput.json(run);
        } else {
            ConsoleOutput.runResult(run);
        }
        return run.exitCode();
    }
}

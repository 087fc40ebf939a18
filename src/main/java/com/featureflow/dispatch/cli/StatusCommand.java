package com.featureflow.dispatch.cli;

import com.featureflow.core.engine.PhaseOrchestrator;
import com.featureflow.core.engine.WorkflowStatus;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.registry.RepositoryContextResolver;
import com.featureflow.core.state.WorkflowState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: featureflow status
 * <p>
 * Shows the current feature, its phase and checkpoints, task progress and the
 * suggested next step. Works without a running workflow by reading the artifacts.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show workflow status for the current feature")
@Component
public class StatusCommand implements Callable<Integer> {

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final PhaseOrchestrator orchestrator;

    public StatusCommand(RepositoryContextResolver contextResolver, PhaseOrchestrator orchestrator) {
        this.contextResolver = contextResolver;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        WorkflowStatus status = orchestrator.status(context);
        if (options.json) {
            ConsoleOutput.json(status);
            return 0;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.field("Feature", status.feature().id());
        ConsoleOutput.field("Branch", status.branch());
        ConsoleOutput.field("Phase", status.currentPhase().id());

        WorkflowState state = status.state();
        if (state != null) {
            ConsoleOutput.field("Mode", state.mode().name().toLowerCase());
            ConsoleOutput.field("Started", state.startedAt());
            ConsoleOutput.field("Completed", join(state.completedPhases()));
            ConsoleOutput.field("Skipped", join(state.skippedPhases()));
            System.out.println();
            System.out.printf("  %-12s %-12s %-8s %s%n", "PHASE", "STATUS", "TASKS", "DETAIL");
            System.out.println("  " + "-".repeat(64));
            for (Map.Entry<Phase, PhaseCheckpoint> entry : state.checkpoints().entrySet()) {
                PhaseCheckpoint cp = entry.getValue();
                System.out.printf("  %-12s %-12s %-8s %s%n", entry.getKey().id(),
                        cp.status().name().toLowerCase(),
                        cp.tasksTotal() > 0 ? cp.tasksCompleted() + "/" + cp.tasksTotal() : "-",
                        cp.failureReason() != null ? cp.failureReason()
                                : cp.currentTaskRef() != null ? "next " + cp.currentTaskRef() : "");
            }
            System.out.println();
        } else {
            ConsoleOutput.info("No workflow in progress; phase derived from artifacts on disk");
        }

        System.out.println("Artifacts:");
        for (ArtifactKind kind : ArtifactKind.values()) {
            ConsoleOutput.doc(kind.docName(), status.availableDocs().contains(kind));
        }
        if (status.progress().total() > 0) {
            System.out.println("Tasks:");
            ConsoleOutput.progress(status.progress());
        }
        if (status.clarificationMarkers() > 0) {
            String line = status.clarificationMarkers() + " open clarification marker(s) in spec.md";
            if (status.clarificationsAboveThreshold()) {
                ConsoleOutput.warn(line);
            } else {
                ConsoleOutput.info(line);
            }
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info("Next: " + status.nextAction());
        return 0;
    }

    private static String join(List<Phase> phases) {
        return phases.isEmpty() ? "-" : phases.stream().map(Phase::id).collect(Collectors.joining(", "));
    }
}

package com.featureflow.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.featureflow.core.error.MissingArtifactException;
import com.featureflow.core.error.PhaseExecutionFailedException;
import com.featureflow.core.error.WorkflowException;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.state.WorkflowState;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Result of driving a workflow until it pauses, halts or finishes.
 *
 * @param outcome    why the run stopped
 * @param feature    the feature being driven
 * @param state      state as last persisted
 * @param phase      phase the run stopped at (next to run when paused)
 * @param message    human-readable explanation
 * @param missing    missing inputs when blocked, otherwise empty
 * @param progress   task progress when the run touched the implement phase
 * @param archivedTo where the state document went on completion, if archived
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowRun(
    RunOutcome outcome,
    Feature feature,
    WorkflowState state,
    Phase phase,
    String message,
    List<ArtifactKind> missing,
    TaskProgress progress,
    Path archivedTo
) {

    public WorkflowRun {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    static WorkflowRun paused(Feature feature, WorkflowState state, Phase phase) {
        return new WorkflowRun(RunOutcome.PAUSED, feature, state, phase,
                "Paused before phase '" + phase.id() + "'; resume with --continue to run it", null, null, null);
    }

    static WorkflowRun blocked(Feature feature, WorkflowState state, Phase phase, List<ArtifactKind> missing) {
        return new WorkflowRun(RunOutcome.BLOCKED, feature, state, phase,
                MissingArtifactException.describe(feature.directoryPath(), missing), missing, null, null);
    }

    static WorkflowRun failed(Feature feature, WorkflowState state, Phase phase, String reason) {
        return new WorkflowRun(RunOutcome.FAILED, feature, state, phase, reason, null, null, null);
    }

    static WorkflowRun inProgress(Feature feature, WorkflowState state, TaskProgress progress) {
        String next = progress.nextPending() != null ? "; next: " + progress.nextPending().id() : "";
        return new WorkflowRun(RunOutcome.IN_PROGRESS, feature, state, Phase.IMPLEMENT,
                progress.completed() + "/" + progress.total() + " tasks complete (" + progress.percentage() + "%)" + next,
                null, progress, null);
    }

    static WorkflowRun done(Feature feature, WorkflowState state, TaskProgress progress, Path archivedTo) {
        return new WorkflowRun(RunOutcome.DONE, feature, state, Phase.DONE,
                "Feature " + feature.id() + " is done", null, progress, archivedTo);
    }

    /** The error this outcome corresponds to, for callers that signal failure by exit code. */
    public Optional<WorkflowException> error() {
        return switch (outcome) {
            case BLOCKED -> Optional.of(new MissingArtifactException(feature.directoryPath(), missing));
            case FAILED -> Optional.of(new PhaseExecutionFailedException(phase, message));
            default -> Optional.empty();
        };
    }

    public int exitCode() {
        return error().map(WorkflowException::exitCode).orElse(0);
    }
}

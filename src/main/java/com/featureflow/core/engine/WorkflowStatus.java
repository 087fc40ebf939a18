package com.featureflow.core.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.state.WorkflowState;

import java.util.List;

/**
 * Snapshot of where a feature stands, built from the saved state when there is one
 * and from the artifacts on disk otherwise.
 *
 * @param feature              the feature reported on
 * @param branch               checked-out branch, if under version control
 * @param state                saved workflow state, {@code null} when no workflow is running
 * @param currentPhase         the phase to work on next
 * @param availableDocs        artifacts present on disk
 * @param progress             fresh parse of the tasks artifact
 * @param clarificationMarkers open clarification markers in the spec
 * @param clarificationsAboveThreshold whether that count exceeds the configured threshold
 * @param nextAction           suggested next step
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStatus(
    Feature feature,
    String branch,
    WorkflowState state,
    Phase currentPhase,
    List<ArtifactKind> availableDocs,
    TaskProgress progress,
    int clarificationMarkers,
    boolean clarificationsAboveThreshold,
    String nextAction
) {}

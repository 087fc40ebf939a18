package com.featureflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Persisted record of one phase's progress.
 *
 * @param status         outcome of the latest attempt
 * @param tasksCompleted completed task count at checkpoint time (cache of the tasks artifact)
 * @param tasksTotal     total task count at checkpoint time
 * @param currentTaskRef identifier of the next pending task, if any
 * @param failureReason  executor or gate message when {@code status} is FAILED
 * @param recordedAt     when the checkpoint was written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseCheckpoint(
    CheckpointStatus status,
    int tasksCompleted,
    int tasksTotal,
    String currentTaskRef,
    String failureReason,
    Instant recordedAt
) {

    public static PhaseCheckpoint of(CheckpointStatus status, Instant at) {
        return new PhaseCheckpoint(status, 0, 0, null, null, at);
    }

    public static PhaseCheckpoint failed(String reason, Instant at) {
        return new PhaseCheckpoint(CheckpointStatus.FAILED, 0, 0, null, reason, at);
    }

    public PhaseCheckpoint withProgress(TaskProgress progress) {
        return new PhaseCheckpoint(status, progress.completed(), progress.total(),
                progress.nextPending() != null ? progress.nextPending().id() : null,
                failureReason, recordedAt);
    }
}

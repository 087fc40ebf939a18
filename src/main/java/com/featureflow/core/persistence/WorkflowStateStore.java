package com.featureflow.core.persistence;

import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.state.WorkflowState;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable home of the single workflow state document of a repository.
 * <p>
 * Single writer, last writer wins: implementations take no locks.
 */
public interface WorkflowStateStore {

    /**
     * Reads the state saved for the repository.
     *
     * @return the state, or empty when none has been saved
     * @throws com.featureflow.core.error.StateCorruptedException if a document exists but cannot be read back
     */
    Optional<WorkflowState> load(Path root);

    /** Replaces the saved state. Either the previous or the new document survives a crash, never a mix. */
    void save(Path root, WorkflowState state);

    /** Removes the saved state, if any. */
    void delete(Path root);

    /**
     * Moves the saved state out of the way, keeping it as history.
     *
     * @return where the document now lives
     */
    Path archive(Path root, WorkflowState state, Instant now);

    /**
     * Applies a phase checkpoint to {@code state} and persists the result.
     *
     * @return the updated state
     */
    default WorkflowState checkpoint(Path root, WorkflowState state, Phase phase,
                                     PhaseCheckpoint checkpoint, Instant now) {
        WorkflowState updated = state.withCheckpoint(phase, checkpoint, now);
        save(root, updated);
        return updated;
    }
}

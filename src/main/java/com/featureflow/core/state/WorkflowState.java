package com.featureflow.core.state;

import com.featureflow.core.model.CheckpointStatus;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.model.WorkflowMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent, versioned record of a feature's progress through the phases.
 * <p>
 * Immutable: every transition returns a new instance. {@code completedPhases}
 * stays in canonical order and {@code currentPhase} is the first phase that is
 * neither completed nor skipped, unless a resume explicitly overrides it.
 */
public record WorkflowState(
    int schemaVersion,
    String featureId,
    Phase currentPhase,
    List<Phase> completedPhases,
    List<Phase> skippedPhases,
    WorkflowMode mode,
    Instant startedAt,
    Instant lastUpdated,
    Map<Phase, PhaseCheckpoint> checkpoints
) {

    public static final int CURRENT_SCHEMA_VERSION = 2;

    public WorkflowState {
        completedPhases = completedPhases == null ? List.of() : List.copyOf(completedPhases);
        skippedPhases = skippedPhases == null ? List.of() : List.copyOf(skippedPhases);
        checkpoints = copyCheckpoints(checkpoints);
    }

    public static WorkflowState start(String featureId, WorkflowMode mode, Instant now) {
        return new WorkflowState(CURRENT_SCHEMA_VERSION, featureId, Phase.values()[0],
                List.of(), List.of(), mode, now, now, Map.of());
    }

    /**
     * Records a checkpoint for {@code phase}. A COMPLETE status appends the phase to
     * {@code completedPhases} and moves {@code currentPhase} to the next outstanding phase;
     * any other status keeps the workflow on {@code phase}.
     */
    public WorkflowState withCheckpoint(Phase phase, PhaseCheckpoint checkpoint, Instant now) {
        var updatedCheckpoints = new EnumMap<Phase, PhaseCheckpoint>(Phase.class);
        updatedCheckpoints.putAll(checkpoints);
        updatedCheckpoints.put(phase, checkpoint);

        var completed = new ArrayList<>(completedPhases);
        Phase current = phase;
        if (checkpoint.status() == CheckpointStatus.COMPLETE) {
            if (!completed.contains(phase)) {
                completed.add(phase);
            }
            current = firstOutstanding(completed, skippedPhases);
        }
        return new WorkflowState(schemaVersion, featureId, current, completed, skippedPhases,
                mode, startedAt, now, updatedCheckpoints);
    }

    /** Records an explicit skip of an optional phase. */
    public WorkflowState withSkipped(Phase phase, Instant now) {
        var skipped = new ArrayList<>(skippedPhases);
        if (!skipped.contains(phase)) {
            skipped.add(phase);
        }
        var updatedCheckpoints = new EnumMap<Phase, PhaseCheckpoint>(Phase.class);
        updatedCheckpoints.putAll(checkpoints);
        updatedCheckpoints.put(phase, PhaseCheckpoint.of(CheckpointStatus.SKIPPED, now));
        return new WorkflowState(schemaVersion, featureId, firstOutstanding(completedPhases, skipped),
                completedPhases, skipped, mode, startedAt, now, updatedCheckpoints);
    }

    public WorkflowState withMode(WorkflowMode newMode, Instant now) {
        return new WorkflowState(schemaVersion, featureId, currentPhase, completedPhases, skippedPhases,
                newMode, startedAt, now, checkpoints);
    }

    /** Repositions the workflow on {@code phase} without touching recorded checkpoints. */
    public WorkflowState withCurrentPhase(Phase phase, Instant now) {
        return new WorkflowState(schemaVersion, featureId, phase, completedPhases, skippedPhases,
                mode, startedAt, now, checkpoints);
    }

    public Optional<PhaseCheckpoint> checkpoint(Phase phase) {
        return Optional.ofNullable(checkpoints.get(phase));
    }

    public boolean finished() {
        return currentPhase == Phase.DONE;
    }

    /** Phase the derivation rule picks, ignoring any resume override. */
    public Phase outstanding() {
        return firstOutstanding(completedPhases, skippedPhases);
    }

    /**
     * Checks the ordering invariants. Returns a description of each violation;
     * an empty list means the state is consistent.
     */
    public List<String> violations() {
        var problems = new ArrayList<String>();
        if (featureId == null || featureId.isBlank()) {
            problems.add("featureId is missing");
        }
        if (currentPhase == null) {
            problems.add("currentPhase is missing");
        }
        if (mode == null) {
            problems.add("mode is missing");
        }
        Set<Phase> settled = EnumSet.noneOf(Phase.class);
        settled.addAll(completedPhases);
        settled.addAll(skippedPhases);
        int previous = -1;
        for (Phase phase : completedPhases) {
            if (phase.isTerminal()) {
                problems.add("completedPhases contains the terminal phase");
            }
            if (phase.ordinal() <= previous) {
                problems.add("completedPhases is out of canonical order at '" + phase.id() + "'");
            }
            previous = phase.ordinal();
            for (Phase earlier : Phase.values()) {
                if (earlier == phase) {
                    break;
                }
                if (!settled.contains(earlier)) {
                    problems.add("'" + phase.id() + "' is completed but earlier phase '"
                            + earlier.id() + "' is neither completed nor skipped");
                }
            }
        }
        for (Phase phase : skippedPhases) {
            if (!phase.isOptional()) {
                problems.add("skippedPhases contains required phase '" + phase.id() + "'");
            }
        }
        return problems;
    }

    private static Phase firstOutstanding(List<Phase> completed, List<Phase> skipped) {
        for (Phase phase : Phase.values()) {
            if (!completed.contains(phase) && !skipped.contains(phase)) {
                return phase;
            }
        }
        return Phase.DONE;
    }

    private static Map<Phase, PhaseCheckpoint> copyCheckpoints(Map<Phase, PhaseCheckpoint> source) {
        var copy = new EnumMap<Phase, PhaseCheckpoint>(Phase.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}

package com.featureflow.core.engine;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.config.FeatureflowProperties;
import com.featureflow.core.config.FeatureflowProperties.CompletionAction;
import com.featureflow.core.error.InvalidModeTransitionException;
import com.featureflow.core.error.MissingArtifactException;
import com.featureflow.core.events.EventBus;
import com.featureflow.core.events.WorkflowEvent;
import com.featureflow.core.executor.PhaseExecutor;
import com.featureflow.core.gate.PrerequisiteGate;
import com.featureflow.core.logging.MdcContext;
import com.featureflow.core.metrics.WorkflowMetrics;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactReport;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.CheckpointStatus;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.GateResult;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.model.PhaseResult;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.model.WorkflowMode;
import com.featureflow.core.persistence.WorkflowStateStore;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.state.WorkflowState;
import com.featureflow.core.tasks.TaskProgressParser;
import com.featureflow.core.template.TemplateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a feature through its phases.
 * <p>
 * Each step loads nothing from memory: the saved {@link WorkflowState} and the
 * artifacts on disk are enough to pick up where the last invocation stopped.
 * Before a phase runs its inputs are checked; after it runs exactly one checkpoint
 * is written for it. A failed phase stays current, so resuming retries it.
 */
@Service
public class PhaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PhaseOrchestrator.class);

    private final FeatureRegistry registry;
    private final PathResolver pathResolver;
    private final PrerequisiteGate gate;
    private final TaskProgressParser taskParser;
    private final WorkflowStateStore store;
    private final TemplateProvider templates;
    private final PhaseExecutor executor;
    private final EventBus eventBus;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final CompletionAction onCompletion;
    private final int clarificationThreshold;

    @Autowired
    public PhaseOrchestrator(FeatureRegistry registry, PathResolver pathResolver, PrerequisiteGate gate,
                             TaskProgressParser taskParser, WorkflowStateStore store,
                             TemplateProvider templates, PhaseExecutor executor, EventBus eventBus,
                             WorkflowMetrics metrics, Clock clock, FeatureflowProperties properties) {
        this(registry, pathResolver, gate, taskParser, store, templates, executor, eventBus, metrics, clock,
                properties.getOnCompletion(), properties.getClarification().getThreshold());
    }

    public PhaseOrchestrator(FeatureRegistry registry, PathResolver pathResolver, PrerequisiteGate gate,
                             TaskProgressParser taskParser, WorkflowStateStore store,
                             TemplateProvider templates, PhaseExecutor executor, EventBus eventBus,
                             WorkflowMetrics metrics, Clock clock, CompletionAction onCompletion,
                             int clarificationThreshold) {
        this.registry = registry;
        this.pathResolver = pathResolver;
        this.gate = gate;
        this.taskParser = taskParser;
        this.store = store;
        this.templates = templates;
        this.executor = executor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.onCompletion = onCompletion;
        this.clarificationThreshold = clarificationThreshold;
    }

    // ── Operations ──────────────────────────────────────────────────

    /**
     * Allocates a new feature for {@code description} and starts its workflow.
     *
     * @param skip           optional phases to skip up front
     * @param continueSignal lets the first pausing phase run without stopping
     */
    public WorkflowRun start(RepositoryContext context, String description, String shortName,
                             WorkflowMode mode, Set<Phase> skip, boolean continueSignal) {
        requireNoActiveWorkflow(context.root());
        requireSkippable(skip);
        Feature feature = registry.allocate(context, description, shortName);
        return begin(context, feature, mode, skip, continueSignal);
    }

    /**
     * Starts the workflow for an existing feature, e.g. one created earlier with
     * {@code create-feature}.
     */
    public WorkflowRun begin(RepositoryContext context, Feature feature, WorkflowMode mode,
                             Set<Phase> skip, boolean continueSignal) {
        requireNoActiveWorkflow(context.root());
        requireSkippable(skip);
        try {
            MdcContext.setFeature(feature.id());
            Instant now = clock.instant();
            WorkflowState state = WorkflowState.start(feature.id(), mode, now);
            for (Phase phase : Phase.values()) {
                if (skip.contains(phase)) {
                    state = state.withSkipped(phase, now);
                }
            }
            store.save(context.root(), state);
            log.info("Started {} workflow for {}", mode, feature.id());
            publish("workflow.started", feature.id(), null, Map.of("mode", mode.name(), "skipped", skip.toString()));

            ArtifactSet artifacts = pathResolver.resolve(context, feature);
            return advance(context.root(), artifacts, state, continueSignal);
        } finally {
            MdcContext.clear();
        }
    }

    public WorkflowRun resume(RepositoryContext context, boolean continueSignal) {
        return resume(context, null, continueSignal);
    }

    /**
     * Picks up the saved workflow. The feature comes from the saved state, its artifacts
     * are re-resolved, and for the implement phase the tasks artifact is re-parsed so that
     * hand-ticked checkboxes win over the cached counts. A done state left behind by a
     * failed archive or delete is cleaned up instead of being run again.
     *
     * @param mode switches the workflow to another mode from here on; {@code null} keeps it
     */
    public WorkflowRun resume(RepositoryContext context, WorkflowMode mode, boolean continueSignal) {
        Path root = context.root();
        WorkflowState state = store.load(root).orElseThrow(() -> new InvalidModeTransitionException(
                "No workflow in progress under " + root + "; start one first"));
        try {
            MdcContext.setFeature(state.featureId());
            Feature feature = registry.find(root, state.featureId());
            if (state.finished()) {
                log.warn("State for {} is done but was not cleaned up; completing it now", feature.id());
                return finish(root, feature, state, null);
            }
            ArtifactSet artifacts = pathResolver.resolve(context, feature);
            if (mode != null && mode != state.mode()) {
                log.info("Switching {} from {} to {} mode", feature.id(), state.mode(), mode);
                state = state.withMode(mode, clock.instant());
                store.save(root, state);
            }
            log.info("Resuming {} at phase {}", feature.id(), state.currentPhase().id());
            if (state.currentPhase() == Phase.IMPLEMENT) {
                state = reconcileTasks(root, artifacts, state);
            }
            return advance(root, artifacts, state, continueSignal);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a skip of an optional phase that has not completed yet.
     *
     * @throws InvalidModeTransitionException for a required or already completed phase, or without a workflow
     */
    public WorkflowState skip(RepositoryContext context, Phase phase) {
        WorkflowState state = store.load(context.root()).orElseThrow(() -> new InvalidModeTransitionException(
                "No workflow in progress under " + context.root() + "; nothing to skip"));
        requireSkippable(Set.of(phase));
        if (state.completedPhases().contains(phase)) {
            throw new InvalidModeTransitionException("Phase '" + phase.id() + "' is already complete");
        }
        if (state.finished()) {
            throw new InvalidModeTransitionException("Workflow for " + state.featureId() + " is already done");
        }
        WorkflowState updated = state.withSkipped(phase, clock.instant());
        store.save(context.root(), updated);
        log.info("Skipped phase {} for {}", phase.id(), state.featureId());
        metrics.recordPhaseResult(phase.id(), "skipped");
        publish("phase.skipped", state.featureId(), phase.id(), Map.of());
        return updated;
    }

    /** Reports where the active feature stands, with or without a running workflow. */
    public WorkflowStatus status(RepositoryContext context) {
        Optional<WorkflowState> saved = store.load(context.root());
        Feature feature = saved.isPresent() && context.featureOverride().isEmpty()
                ? registry.find(context.root(), saved.get().featureId())
                : registry.resolveCurrent(context);
        WorkflowState state = saved.filter(s -> s.featureId().equals(feature.id())).orElse(null);

        ArtifactSet artifacts = pathResolver.resolve(context, feature);
        ArtifactReport report = pathResolver.inspect(artifacts);
        TaskProgress progress = taskParser.computeProgress(taskParser.parse(artifacts.path(ArtifactKind.TASKS)));
        int markers = report.isPresent(ArtifactKind.SPEC)
                ? PrerequisiteGate.countClarificationMarkers(artifacts.path(ArtifactKind.SPEC))
                : 0;
        Phase current = state != null ? state.currentPhase() : derivePhase(report, progress);

        return new WorkflowStatus(feature, context.branch().orElse(null), state, current,
                report.availableDocs(), progress, markers, markers > clarificationThreshold,
                nextAction(current, state, progress, markers));
    }

    // ── Step loop ───────────────────────────────────────────────────

    private WorkflowRun advance(Path root, ArtifactSet artifacts, WorkflowState state, boolean continueSignal) {
        Feature feature = artifacts.feature();
        boolean signal = continueSignal;
        TaskProgress progress = null;

        while (!state.currentPhase().isTerminal()) {
            Phase phase = state.currentPhase();
            if (state.mode().pausesBefore(phase)) {
                if (!signal) {
                    log.info("Pausing before phase {}", phase.id());
                    publish("workflow.paused", feature.id(), phase.id(), Map.of("mode", state.mode().name()));
                    return WorkflowRun.paused(feature, state, phase);
                }
                signal = false;
            }

            MdcContext.setPhase(feature.id(), phase.id());
            try {
                GateResult gateResult = gate.check(phase.requiredInputs(), artifacts);
                if (!gateResult.passed()) {
                    String reason = MissingArtifactException.describe(artifacts.featureDirectory(), gateResult.missing());
                    state = store.checkpoint(root, state, phase,
                            PhaseCheckpoint.failed(reason, clock.instant()), clock.instant());
                    log.warn("Phase {} blocked: {}", phase.id(), reason);
                    metrics.recordPhaseResult(phase.id(), "blocked");
                    publish("phase.blocked", feature.id(), phase.id(), Map.of("missing", gateResult.missing().toString()));
                    return WorkflowRun.blocked(feature, state, phase, gateResult.missing());
                }

                prepareOutputs(phase, artifacts);
                publish("phase.started", feature.id(), phase.id(), Map.of());
                log.info("Running phase {}", phase.id());

                long startMs = System.currentTimeMillis();
                PhaseResult result = runExecutor(phase, artifacts);
                metrics.recordPhaseDuration(phase.id(), System.currentTimeMillis() - startMs);

                if (!result.success()) {
                    state = store.checkpoint(root, state, phase,
                            PhaseCheckpoint.failed(result.reason(), clock.instant()), clock.instant());
                    log.warn("Phase {} failed: {}", phase.id(), result.reason());
                    metrics.recordPhaseResult(phase.id(), "failed");
                    publish("phase.failed", feature.id(), phase.id(), Map.of("reason", String.valueOf(result.reason())));
                    return WorkflowRun.failed(feature, state, phase, result.reason());
                }

                if (phase == Phase.IMPLEMENT) {
                    progress = taskParser.computeProgress(taskParser.parse(artifacts.path(ArtifactKind.TASKS)));
                    metrics.recordTaskCompletion(progress.percentage());
                    if (progress.total() > 0 && !progress.finished()) {
                        state = store.checkpoint(root, state, phase,
                                PhaseCheckpoint.of(CheckpointStatus.IN_PROGRESS, clock.instant()).withProgress(progress),
                                clock.instant());
                        log.info("Implementation at {}/{} tasks", progress.completed(), progress.total());
                        metrics.recordPhaseResult(phase.id(), "in_progress");
                        return WorkflowRun.inProgress(feature, state, progress);
                    }
                    state = store.checkpoint(root, state, phase,
                            PhaseCheckpoint.of(CheckpointStatus.COMPLETE, clock.instant()).withProgress(progress),
                            clock.instant());
                } else {
                    state = store.checkpoint(root, state, phase,
                            PhaseCheckpoint.of(CheckpointStatus.COMPLETE, clock.instant()), clock.instant());
                }
                log.info("Phase {} complete", phase.id());
                metrics.recordPhaseResult(phase.id(), "complete");
                publish("phase.completed", feature.id(), phase.id(), new HashMap<String, Object>(result.metadata()));
            } finally {
                MdcContext.clearPhase();
            }
        }
        return finish(root, feature, state, progress);
    }

    private WorkflowRun finish(Path root, Feature feature, WorkflowState state, TaskProgress progress) {
        Path archivedTo = null;
        if (onCompletion == CompletionAction.ARCHIVE) {
            archivedTo = store.archive(root, state, clock.instant());
            log.info("Workflow for {} done; state archived to {}", feature.id(), archivedTo);
        } else {
            store.delete(root);
            log.info("Workflow for {} done; state removed", feature.id());
        }
        publish("workflow.completed", feature.id(), null,
                archivedTo != null ? Map.of("archivedTo", archivedTo.toString()) : Map.of());
        return WorkflowRun.done(feature, state, progress, archivedTo);
    }

    private PhaseResult runExecutor(Phase phase, ArtifactSet artifacts) {
        try {
            PhaseResult result = executor.execute(phase, artifacts);
            return result != null ? result : PhaseResult.failure("Executor returned no result");
        } catch (RuntimeException e) {
            log.error("Executor threw during phase {}", phase.id(), e);
            return PhaseResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Creates any output artifact that does not exist yet from its template. */
    private void prepareOutputs(Phase phase, ArtifactSet artifacts) {
        for (ArtifactKind kind : phase.outputs()) {
            Path path = artifacts.path(kind);
            if (!PathResolver.isPresent(kind, path)) {
                templates.createFromTemplate(kind, path);
            }
        }
    }

    /** The artifact is the source of truth; a stale cached count is rewritten. */
    private WorkflowState reconcileTasks(Path root, ArtifactSet artifacts, WorkflowState state) {
        TaskProgress fresh = taskParser.computeProgress(taskParser.parse(artifacts.path(ArtifactKind.TASKS)));
        Optional<PhaseCheckpoint> cached = state.checkpoint(Phase.IMPLEMENT);
        if (cached.isEmpty()) {
            return state;
        }
        PhaseCheckpoint checkpoint = cached.get();
        if (checkpoint.tasksCompleted() == fresh.completed() && checkpoint.tasksTotal() == fresh.total()) {
            return state;
        }
        log.info("Tasks artifact changed since the last checkpoint: {}/{} -> {}/{}",
                checkpoint.tasksCompleted(), checkpoint.tasksTotal(), fresh.completed(), fresh.total());
        WorkflowState reconciled = state.withCheckpoint(Phase.IMPLEMENT, checkpoint.withProgress(fresh), clock.instant());
        store.save(root, reconciled);
        return reconciled;
    }

    // ── Status derivation ──────────────────────────────────────────

    /** Best guess at the phase from what is on disk, for features without saved state. */
    static Phase derivePhase(ArtifactReport report, TaskProgress progress) {
        if (!report.isPresent(ArtifactKind.SPEC)) {
            return Phase.SPECIFY;
        }
        if (!report.isPresent(ArtifactKind.PLAN)) {
            return Phase.PLAN;
        }
        if (!report.isPresent(ArtifactKind.TASKS)) {
            return Phase.TASKS;
        }
        return progress.finished() ? Phase.DONE : Phase.IMPLEMENT;
    }

    private String nextAction(Phase current, WorkflowState state, TaskProgress progress, int markers) {
        if (state != null) {
            Optional<PhaseCheckpoint> checkpoint = state.checkpoint(current);
            if (checkpoint.isPresent() && checkpoint.get().status() == CheckpointStatus.FAILED) {
                return "Fix the problem reported for '" + current.id() + "' (" + checkpoint.get().failureReason()
                        + ") and resume";
            }
        }
        return switch (current) {
            case PRINCIPLES -> "Record the project principles, then resume";
            case SPECIFY -> "Write the feature specification (spec.md)";
            case CLARIFY -> markers > 0
                    ? "Resolve " + markers + " open clarification marker(s) in spec.md, or skip clarify"
                    : "Review the spec for open questions, or skip clarify";
            case PLAN -> markers > clarificationThreshold
                    ? "Resolve " + markers + " open clarification marker(s) before planning"
                    : "Create the implementation plan (plan.md)";
            case TASKS -> "Break the plan down into tasks (tasks.md)";
            case ANALYZE -> "Cross-check spec, plan and tasks for consistency, or skip analyze";
            case IMPLEMENT -> progress.total() == 0
                    ? "Start implementing the tasks"
                    : "Continue implementation: " + progress.percentage() + "% done"
                            + (progress.nextPending() != null ? ", next " + progress.nextPending().id() : "");
            case DONE -> "Feature is complete";
        };
    }

    private void requireNoActiveWorkflow(Path root) {
        store.load(root).filter(s -> !s.finished()).ifPresent(active -> {
            throw new InvalidModeTransitionException("A workflow for " + active.featureId()
                    + " is in progress at phase '" + active.currentPhase().id() + "'; resume or finish it first");
        });
    }

    private static void requireSkippable(Set<Phase> phases) {
        for (Phase phase : phases) {
            if (!phase.isOptional()) {
                throw new InvalidModeTransitionException("Phase '" + phase.id() + "' is required and cannot be skipped");
            }
        }
    }

    private void publish(String type, String featureId, String phase, Map<String, Object> payload) {
        eventBus.publish(new WorkflowEvent(type, featureId, phase, payload, clock.instant()));
    }
}

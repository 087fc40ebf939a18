package com.featureflow.core.engine;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.config.FeatureflowProperties.CompletionAction;
import com.featureflow.core.error.ErrorKind;
import com.featureflow.core.error.InvalidModeTransitionException;
import com.featureflow.core.events.EventBus;
import com.featureflow.core.events.WorkflowEvent;
import com.featureflow.core.executor.PhaseExecutor;
import com.featureflow.core.gate.PrerequisiteGate;
import com.featureflow.core.metrics.WorkflowMetrics;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactReport;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.CheckpointStatus;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.model.PhaseResult;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.model.WorkflowMode;
import com.featureflow.core.persistence.InMemoryWorkflowStateStore;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.state.WorkflowState;
import com.featureflow.core.tasks.TaskProgressParser;
import com.featureflow.core.template.TemplateProvider;
import com.featureflow.core.vcs.GitCli;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PhaseOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ALL_DONE = "- [x] T001 Create project\n- [x] T002 Add login form\n";

    @TempDir
    Path root;

    private RepositoryContext context;
    private InMemoryWorkflowStateStore store;
    private ScriptedExecutor executor;
    private List<ArtifactKind> templated;
    private List<WorkflowEvent> events;
    private SimpleMeterRegistry meterRegistry;
    private FeatureRegistry registry;
    private PathResolver pathResolver;
    private TaskProgressParser parser;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        context = RepositoryContext.of(root);
        store = spy(new InMemoryWorkflowStateStore());
        executor = new ScriptedExecutor();
        templated = new ArrayList<>();
        events = new ArrayList<>();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        pathResolver = new PathResolver("specs");
        parser = new TaskProgressParser();
        registry = new FeatureRegistry(pathResolver, mock(GitCli.class), new WorkflowMetrics(meterRegistry),
                eventBus, 3);
    }

    private PhaseOrchestrator orchestrator(CompletionAction onCompletion) {
        TemplateProvider templates = (kind, destination) -> templated.add(kind);
        return new PhaseOrchestrator(registry, pathResolver, new PrerequisiteGate(pathResolver), parser, store,
                templates, executor, eventBus, new WorkflowMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC), onCompletion, 3);
    }

    private PhaseOrchestrator orchestrator() {
        return orchestrator(CompletionAction.ARCHIVE);
    }

    private WorkflowRun start(PhaseOrchestrator orchestrator, WorkflowMode mode, Set<Phase> skip) {
        return orchestrator.start(context, "Add OAuth2 login", null, mode, skip, false);
    }

    private Path featureDir() {
        return root.resolve("specs/001-add-oauth2-login").toAbsolutePath().normalize();
    }

    private WorkflowState saved() {
        return store.load(root).orElseThrow();
    }

    private void verifyCheckpoints(Phase phase, int count) {
        verify(store, times(count)).checkpoint(any(), any(), eq(phase), any(), any());
    }

    // ── Unattended runs ─────────────────────────────────────────────

    @Nested
    @DisplayName("unattended")
    class Unattended {

        @Test
        @DisplayName("visits every phase in canonical order with one checkpoint each")
        void canonicalOrder() {
            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.DONE, run.outcome());
            assertEquals(List.of(Phase.PRINCIPLES, Phase.SPECIFY, Phase.CLARIFY, Phase.PLAN, Phase.TASKS,
                    Phase.ANALYZE, Phase.IMPLEMENT), executor.executed);
            for (Phase phase : Phase.values()) {
                verifyCheckpoints(phase, phase.isTerminal() ? 0 : 1);
            }
            assertEquals(0, run.exitCode());
        }

        @Test
        @DisplayName("the final state has every non-terminal phase completed in order")
        void finalState() {
            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            WorkflowState finalState = run.state();
            assertTrue(finalState.finished());
            assertEquals(List.of(Phase.PRINCIPLES, Phase.SPECIFY, Phase.CLARIFY, Phase.PLAN, Phase.TASKS,
                    Phase.ANALYZE, Phase.IMPLEMENT), finalState.completedPhases());
            assertTrue(finalState.violations().isEmpty());
            PhaseCheckpoint implement = finalState.checkpoint(Phase.IMPLEMENT).orElseThrow();
            assertEquals(2, implement.tasksCompleted());
            assertEquals(2, implement.tasksTotal());
        }

        @Test
        @DisplayName("archives the state on completion by default")
        void archives() {
            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertNotNull(run.archivedTo());
            assertEquals(1, store.archived().size());
            assertTrue(store.load(root).isEmpty());
        }

        @Test
        @DisplayName("deletes the state on completion when configured to")
        void deletes() {
            WorkflowRun run = start(orchestrator(CompletionAction.DELETE), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.DONE, run.outcome());
            assertNull(run.archivedTo());
            assertTrue(store.archived().isEmpty());
            assertTrue(store.load(root).isEmpty());
        }

        @Test
        @DisplayName("creates missing outputs from templates before the executor runs")
        void templatesFirst() {
            start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(List.of(ArtifactKind.SPEC, ArtifactKind.PLAN, ArtifactKind.TASKS), templated);
        }

        @Test
        @DisplayName("publishes lifecycle events in order")
        void events() {
            start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            List<String> types = events.stream().map(WorkflowEvent::eventType).toList();
            assertEquals("feature.allocated", types.get(0));
            assertEquals("workflow.started", types.get(1));
            assertEquals("workflow.completed", types.get(types.size() - 1));
            assertEquals(7, types.stream().filter("phase.completed"::equals).count());
            assertTrue(events.stream().allMatch(e -> "001-add-oauth2-login".equals(e.featureId())));
        }

        @Test
        @DisplayName("records phase metrics")
        void metrics() {
            start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(1.0, meterRegistry.find("featureflow.phase.results")
                    .tags("phase", "plan", "status", "complete").counter().count());
            assertEquals(1, meterRegistry.find("featureflow.phase.duration").tag("phase", "specify")
                    .timer().count());
        }
    }

    // ── Failure and resume ──────────────────────────────────────────

    @Nested
    @DisplayName("failure and resume")
    class FailureAndResume {

        @Test
        @DisplayName("a plan failure stops the run and resume re-enters plan")
        void planFailureThenResume() {
            executor.script(Phase.PLAN, artifacts -> PhaseResult.failure("planner crashed"));
            PhaseOrchestrator orchestrator = orchestrator();

            WorkflowRun failed = start(orchestrator, WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.FAILED, failed.outcome());
            assertEquals(Phase.PLAN, failed.phase());
            assertEquals(ErrorKind.PHASE_EXECUTION_FAILED.exitCode(), failed.exitCode());
            WorkflowState afterFailure = saved();
            assertEquals(Phase.PLAN, afterFailure.currentPhase());
            assertEquals(CheckpointStatus.FAILED, afterFailure.checkpoint(Phase.PLAN).orElseThrow().status());
            assertEquals("planner crashed", afterFailure.checkpoint(Phase.PLAN).orElseThrow().failureReason());
            PhaseCheckpoint specify = afterFailure.checkpoint(Phase.SPECIFY).orElseThrow();

            executor.executed.clear();
            WorkflowRun resumed = orchestrator.resume(context, false);

            assertEquals(RunOutcome.DONE, resumed.outcome());
            assertEquals(Phase.PLAN, executor.executed.get(0));
            assertFalse(executor.executed.contains(Phase.SPECIFY));
            assertEquals(specify, resumed.state().checkpoint(Phase.SPECIFY).orElseThrow());
            assertEquals(CheckpointStatus.COMPLETE, resumed.state().checkpoint(Phase.PLAN).orElseThrow().status());
            verifyCheckpoints(Phase.SPECIFY, 1);
            verifyCheckpoints(Phase.PLAN, 2);
        }

        @Test
        @DisplayName("an executor that throws is recorded as a failure")
        void executorThrows() {
            executor.script(Phase.SPECIFY, artifacts -> {
                throw new IllegalStateException("model unavailable");
            });

            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.FAILED, run.outcome());
            assertTrue(run.message().contains("model unavailable"), run.message());
            assertEquals(Phase.SPECIFY, saved().currentPhase());
        }

        @Test
        @DisplayName("missing inputs block the phase and list every missing artifact")
        void blocked() {
            executor.script(Phase.SPECIFY, artifacts -> PhaseResult.succeeded());

            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.BLOCKED, run.outcome());
            assertEquals(Phase.CLARIFY, run.phase());
            assertEquals(List.of(ArtifactKind.SPEC), run.missing());
            assertEquals(ErrorKind.MISSING_ARTIFACT.exitCode(), run.exitCode());
            PhaseCheckpoint checkpoint = saved().checkpoint(Phase.CLARIFY).orElseThrow();
            assertEquals(CheckpointStatus.FAILED, checkpoint.status());
            assertTrue(checkpoint.failureReason().contains("spec.md"));
            assertFalse(executor.executed.contains(Phase.CLARIFY));
        }

        @Test
        @DisplayName("resume without saved state is rejected")
        void resumeWithoutState() {
            var ex = assertThrows(InvalidModeTransitionException.class,
                    () -> orchestrator().resume(context, false));
            assertEquals(ErrorKind.INVALID_MODE_TRANSITION, ex.kind());
        }

        @Test
        @DisplayName("a done state whose archive failed is archived on the next resume")
        void archiveFailureThenResume() {
            doThrow(new UncheckedIOException(new IOException("disk full")))
                    .doCallRealMethod()
                    .when(store).archive(any(), any(), any());
            PhaseOrchestrator orchestrator = orchestrator();

            assertThrows(UncheckedIOException.class, () -> start(orchestrator, WorkflowMode.UNATTENDED, Set.of()));
            assertTrue(saved().finished());

            executor.executed.clear();
            WorkflowRun resumed = orchestrator.resume(context, false);

            assertEquals(RunOutcome.DONE, resumed.outcome());
            assertTrue(executor.executed.isEmpty());
            assertTrue(store.load(root).isEmpty());
            assertEquals(1, store.archived().size());
            assertThrows(InvalidModeTransitionException.class, () -> orchestrator.resume(context, false));
        }

        @Test
        @DisplayName("starting while a workflow is active is rejected")
        void startWhileActive() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());

            assertThrows(InvalidModeTransitionException.class,
                    () -> orchestrator.start(context, "Another feature", null, WorkflowMode.UNATTENDED, Set.of(), false));
            assertFalse(Files.exists(root.resolve("specs/002-another-feature")));
        }
    }

    // ── Pausing ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("pausing")
    class Pausing {

        @Test
        @DisplayName("interactive mode pauses before the first phase")
        void interactivePausesFirst() {
            WorkflowRun run = start(orchestrator(), WorkflowMode.INTERACTIVE, Set.of());

            assertEquals(RunOutcome.PAUSED, run.outcome());
            assertEquals(Phase.PRINCIPLES, run.phase());
            assertTrue(executor.executed.isEmpty());
            assertEquals(Phase.PRINCIPLES, saved().currentPhase());
        }

        @Test
        @DisplayName("the continue signal runs exactly one paused phase")
        void continueRunsOne() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());

            WorkflowRun run = orchestrator.resume(context, true);

            assertEquals(RunOutcome.PAUSED, run.outcome());
            assertEquals(Phase.SPECIFY, run.phase());
            assertEquals(List.of(Phase.PRINCIPLES), executor.executed);
        }

        @Test
        @DisplayName("resume without the continue signal stays paused")
        void resumeWithoutSignal() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());

            WorkflowRun run = orchestrator.resume(context, false);

            assertEquals(RunOutcome.PAUSED, run.outcome());
            assertTrue(executor.executed.isEmpty());
        }

        @Test
        @DisplayName("staged mode runs through analyze and pauses before implement")
        void stagedPausesBeforeImplement() {
            PhaseOrchestrator orchestrator = orchestrator();

            WorkflowRun run = start(orchestrator, WorkflowMode.STAGED, Set.of());

            assertEquals(RunOutcome.PAUSED, run.outcome());
            assertEquals(Phase.IMPLEMENT, run.phase());
            assertEquals(List.of(Phase.PRINCIPLES, Phase.SPECIFY, Phase.CLARIFY, Phase.PLAN, Phase.TASKS,
                    Phase.ANALYZE), executor.executed);

            WorkflowRun finished = orchestrator.resume(context, true);
            assertEquals(RunOutcome.DONE, finished.outcome());
        }

        @Test
        @DisplayName("resume can switch the mode")
        void switchMode() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());

            WorkflowRun run = orchestrator.resume(context, WorkflowMode.UNATTENDED, false);

            assertEquals(RunOutcome.DONE, run.outcome());
            assertEquals(WorkflowMode.UNATTENDED, run.state().mode());
        }
    }

    // ── Skipping ────────────────────────────────────────────────────

    @Nested
    @DisplayName("skipping")
    class Skipping {

        @Test
        @DisplayName("optional phases skipped at start are never executed")
        void skipAtStart() {
            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of(Phase.CLARIFY, Phase.ANALYZE));

            assertEquals(RunOutcome.DONE, run.outcome());
            assertFalse(executor.executed.contains(Phase.CLARIFY));
            assertFalse(executor.executed.contains(Phase.ANALYZE));
            assertEquals(List.of(Phase.CLARIFY, Phase.ANALYZE), run.state().skippedPhases());
            assertEquals(CheckpointStatus.SKIPPED, run.state().checkpoint(Phase.ANALYZE).orElseThrow().status());
        }

        @Test
        @DisplayName("skipping a required phase is rejected")
        void requiredPhase() {
            PhaseOrchestrator orchestrator = orchestrator();

            assertThrows(InvalidModeTransitionException.class,
                    () -> start(orchestrator, WorkflowMode.UNATTENDED, Set.of(Phase.PLAN)));
            assertFalse(Files.exists(featureDir()));

            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());
            assertThrows(InvalidModeTransitionException.class, () -> orchestrator.skip(context, Phase.TASKS));
        }

        @Test
        @DisplayName("skipping the current optional phase moves the workflow past it")
        void skipCurrent() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());
            orchestrator.resume(context, true);
            orchestrator.resume(context, true);
            assertEquals(Phase.CLARIFY, saved().currentPhase());

            WorkflowState skipped = orchestrator.skip(context, Phase.CLARIFY);

            assertEquals(Phase.PLAN, skipped.currentPhase());
            assertEquals(skipped, saved());
        }

        @Test
        @DisplayName("a later optional phase can be skipped ahead of time")
        void skipAhead() {
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.INTERACTIVE, Set.of());

            WorkflowState skipped = orchestrator.skip(context, Phase.ANALYZE);

            assertEquals(Phase.PRINCIPLES, skipped.currentPhase());
            assertEquals(List.of(Phase.ANALYZE), skipped.skippedPhases());
        }

        @Test
        @DisplayName("skipping a completed phase is rejected")
        void completedPhase() {
            PhaseOrchestrator orchestrator = orchestrator();
            executor.script(Phase.PLAN, artifacts -> PhaseResult.failure("stop here"));
            start(orchestrator, WorkflowMode.UNATTENDED, Set.of());

            assertThrows(InvalidModeTransitionException.class, () -> orchestrator.skip(context, Phase.CLARIFY));
        }

        @Test
        @DisplayName("skipping without a workflow is rejected")
        void noWorkflow() {
            assertThrows(InvalidModeTransitionException.class, () -> orchestrator().skip(context, Phase.CLARIFY));
        }
    }

    // ── Implementation progress ─────────────────────────────────────

    @Nested
    @DisplayName("implementation")
    class Implementation {

        @Test
        @DisplayName("open tasks keep implement in progress with cached counts")
        void inProgress() {
            executor.tasksContent = "- [x] T001 one\n- [ ] T002 two\n- [ ] T003 three\n";

            WorkflowRun run = start(orchestrator(), WorkflowMode.UNATTENDED, Set.of());

            assertEquals(RunOutcome.IN_PROGRESS, run.outcome());
            assertEquals(0, run.exitCode());
            assertEquals(33, run.progress().percentage());
            PhaseCheckpoint checkpoint = saved().checkpoint(Phase.IMPLEMENT).orElseThrow();
            assertEquals(CheckpointStatus.IN_PROGRESS, checkpoint.status());
            assertEquals(1, checkpoint.tasksCompleted());
            assertEquals(3, checkpoint.tasksTotal());
            assertEquals("T002", checkpoint.currentTaskRef());
            assertEquals(Phase.IMPLEMENT, saved().currentPhase());
        }

        @Test
        @DisplayName("hand-ticked boxes win over the cached counts on resume")
        void reconcile() throws IOException {
            executor.tasksContent = "- [x] T001 one\n- [ ] T002 two\n- [ ] T003 three\n";
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.UNATTENDED, Set.of());
            Files.writeString(featureDir().resolve("tasks.md"), "- [x] T001 one\n- [x] T002 two\n- [ ] T003 three\n");

            WorkflowRun run = orchestrator.resume(context, WorkflowMode.INTERACTIVE, false);

            assertEquals(RunOutcome.PAUSED, run.outcome());
            PhaseCheckpoint checkpoint = saved().checkpoint(Phase.IMPLEMENT).orElseThrow();
            assertEquals(2, checkpoint.tasksCompleted());
            assertEquals("T003", checkpoint.currentTaskRef());
        }

        @Test
        @DisplayName("implement completes once every box is ticked")
        void completesWhenTicked() throws IOException {
            executor.tasksContent = "- [ ] T001 one\n";
            PhaseOrchestrator orchestrator = orchestrator();
            assertEquals(RunOutcome.IN_PROGRESS, start(orchestrator, WorkflowMode.UNATTENDED, Set.of()).outcome());

            Files.writeString(featureDir().resolve("tasks.md"), "- [x] T001 one\n");
            WorkflowRun run = orchestrator.resume(context, false);

            assertEquals(RunOutcome.DONE, run.outcome());
            assertEquals(100, run.progress().percentage());
        }
    }

    // ── Status ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("reports the saved phase while a workflow runs")
        void fromState() {
            executor.script(Phase.PLAN, artifacts -> PhaseResult.failure("planner crashed"));
            PhaseOrchestrator orchestrator = orchestrator();
            start(orchestrator, WorkflowMode.UNATTENDED, Set.of());

            WorkflowStatus status = orchestrator.status(context);

            assertEquals("001-add-oauth2-login", status.feature().id());
            assertEquals(Phase.PLAN, status.currentPhase());
            assertNotNull(status.state());
            assertTrue(status.nextAction().contains("planner crashed"));
            assertTrue(status.availableDocs().contains(ArtifactKind.SPEC));
        }

        @Test
        @DisplayName("derives the phase from the artifacts without saved state")
        void derived() throws IOException {
            Path dir = Files.createDirectories(root.resolve("specs/004-search"));
            Files.writeString(dir.resolve("spec.md"), "- [NEEDS CLARIFICATION: a]\n- [NEEDS CLARIFICATION: b]\n"
                    + "- [NEEDS CLARIFICATION: c]\n- [NEEDS CLARIFICATION: d]\n");

            WorkflowStatus status = orchestrator().status(context);

            assertNull(status.state());
            assertEquals("004-search", status.feature().id());
            assertEquals(Phase.PLAN, status.currentPhase());
            assertEquals(4, status.clarificationMarkers());
            assertTrue(status.clarificationsAboveThreshold());
            assertTrue(status.nextAction().contains("4 open clarification"));
        }

        @Test
        @DisplayName("derivePhase follows the artifacts on disk")
        void derivePhase() throws IOException {
            Path dir = Files.createDirectories(root.resolve("specs/004-search"));
            Feature feature = Feature.fromId("004-search", dir);
            ArtifactSet set = pathResolver.resolve(context, feature);

            assertEquals(Phase.SPECIFY, PhaseOrchestrator.derivePhase(pathResolver.inspect(set), TaskProgress.EMPTY));

            Files.writeString(dir.resolve("spec.md"), "# spec");
            Files.writeString(dir.resolve("plan.md"), "# plan");
            assertEquals(Phase.TASKS, PhaseOrchestrator.derivePhase(pathResolver.inspect(set), TaskProgress.EMPTY));

            Files.writeString(dir.resolve("tasks.md"), "- [x] T001 a\n- [ ] T002 b\n");
            ArtifactReport report = pathResolver.inspect(set);
            assertEquals(Phase.IMPLEMENT,
                    PhaseOrchestrator.derivePhase(report, parser.computeProgress(parser.parse(set.path(ArtifactKind.TASKS)))));

            Files.writeString(dir.resolve("tasks.md"), "- [x] T001 a\n- [x] T002 b\n");
            assertEquals(Phase.DONE,
                    PhaseOrchestrator.derivePhase(report, parser.computeProgress(parser.parse(set.path(ArtifactKind.TASKS)))));
        }
    }

    /**
     * Writes each phase's outputs and succeeds, unless a scripted step is queued for the phase.
     */
    private static final class ScriptedExecutor implements PhaseExecutor {

        final List<Phase> executed = new ArrayList<>();
        final Map<Phase, Deque<Function<ArtifactSet, PhaseResult>>> scripts = new EnumMap<>(Phase.class);
        String tasksContent = ALL_DONE;

        void script(Phase phase, Function<ArtifactSet, PhaseResult> step) {
            scripts.computeIfAbsent(phase, p -> new ArrayDeque<>()).addLast(step);
        }

        @Override
        public PhaseResult execute(Phase phase, ArtifactSet artifacts) {
            executed.add(phase);
            Deque<Function<ArtifactSet, PhaseResult>> queue = scripts.get(phase);
            if (queue != null && !queue.isEmpty()) {
                return queue.poll().apply(artifacts);
            }
            try {
                Files.createDirectories(artifacts.featureDirectory());
                for (ArtifactKind kind : phase.outputs()) {
                    String content = kind == ArtifactKind.TASKS ? tasksContent : "# " + kind.id() + "\n";
                    Path path = artifacts.path(kind);
                    if (kind != ArtifactKind.TASKS || !Files.exists(path)) {
                        Files.writeString(path, content);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return PhaseResult.succeeded(Map.of("executor", "scripted"));
        }
    }
}

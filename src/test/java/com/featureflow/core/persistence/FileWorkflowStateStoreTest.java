package com.featureflow.core.persistence;

import com.featureflow.core.config.FeatureflowConfig;
import com.featureflow.core.error.ErrorKind;
import com.featureflow.core.error.StateCorruptedException;
import com.featureflow.core.model.CheckpointStatus;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseCheckpoint;
import com.featureflow.core.model.TaskItem;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.model.WorkflowMode;
import com.featureflow.core.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileWorkflowStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2026-03-01T10:05:00Z");

    @TempDir
    Path root;

    private FileWorkflowStateStore store;

    @BeforeEach
    void setUp() {
        store = new FileWorkflowStateStore(FeatureflowConfig.workflowObjectMapper(), new WorkflowStateMigrator(),
                ".featureflow-state.json", ".featureflow/archive");
    }

    private WorkflowState sampleState() {
        var progress = new TaskProgress(2, 5, 40, new TaskItem("T003", "wire it", false, false, null, 7));
        return WorkflowState.start("001-login", WorkflowMode.STAGED, T0)
                .withCheckpoint(Phase.PRINCIPLES, PhaseCheckpoint.of(CheckpointStatus.COMPLETE, T0), T0)
                .withCheckpoint(Phase.SPECIFY, PhaseCheckpoint.of(CheckpointStatus.COMPLETE, T0), T0)
                .withSkipped(Phase.CLARIFY, T0)
                .withCheckpoint(Phase.PLAN, PhaseCheckpoint.failed("executor exited with 2", T1), T1)
                .withCheckpoint(Phase.IMPLEMENT,
                        PhaseCheckpoint.of(CheckpointStatus.IN_PROGRESS, T1).withProgress(progress), T1);
    }

    // -- Round trip --

    @Test
    @DisplayName("load returns empty when nothing was saved")
    void loadEmpty() {
        assertEquals(Optional.empty(), store.load(root));
    }

    @Test
    @DisplayName("save then load returns an equal state")
    void roundTrip() {
        WorkflowState state = sampleState();

        store.save(root, state);

        assertEquals(Optional.of(state), store.load(root));
    }

    @Test
    @DisplayName("saved document uses wire names and carries the schema version")
    void wireFormat() throws IOException {
        store.save(root, sampleState());

        String json = Files.readString(store.stateFile(root));
        assertTrue(json.contains("\"schemaVersion\" : 2"), json);
        assertTrue(json.contains("\"mode\" : \"staged\""), json);
        assertTrue(json.contains("\"status\" : \"in_progress\""), json);
        assertTrue(json.contains("\"clarify\""), json);
        assertTrue(json.contains("\"currentTaskRef\" : \"T003\""), json);
        assertTrue(json.contains("2026-03-01T10:00:00Z"), json);
    }

    @Test
    @DisplayName("save leaves no temporary files behind")
    void noTempFiles() throws IOException {
        store.save(root, sampleState());
        store.save(root, sampleState());

        try (var files = Files.list(root)) {
            assertEquals(List.of(store.stateFile(root)), files.toList());
        }
    }

    // -- Crash safety --

    @Test
    @DisplayName("a save interrupted before the rename leaves the previous document intact")
    void interruptedSave() throws IOException {
        WorkflowState previous = WorkflowState.start("001-login", WorkflowMode.INTERACTIVE, T0);
        store.save(root, previous);
        String before = Files.readString(store.stateFile(root));

        var crashing = new FileWorkflowStateStore(FeatureflowConfig.workflowObjectMapper(),
                new WorkflowStateMigrator(), ".featureflow-state.json", ".featureflow/archive") {
            @Override
            protected void commit(Path temp, Path target) throws IOException {
                throw new IOException("simulated crash before rename");
            }
        };

        assertThrows(UncheckedIOException.class, () -> crashing.save(root, sampleState()));

        assertEquals(before, Files.readString(store.stateFile(root)));
        assertEquals(Optional.of(previous), store.load(root));
        try (var files = Files.list(root)) {
            assertEquals(1, files.count());
        }
    }

    // -- Corruption --

    @Nested
    @DisplayName("corrupted documents")
    class Corrupted {

        @Test
        @DisplayName("invalid JSON raises StateCorrupted and leaves the file untouched")
        void invalidJson() throws IOException {
            Files.writeString(store.stateFile(root), "{ \"featureId\": ");

            var ex = assertThrows(StateCorruptedException.class, () -> store.load(root));

            assertEquals(ErrorKind.STATE_CORRUPTED, ex.kind());
            assertEquals(store.stateFile(root), ex.stateFile());
            assertEquals("{ \"featureId\": ", Files.readString(store.stateFile(root)));
        }

        @Test
        @DisplayName("a JSON array is not a state document")
        void notAnObject() throws IOException {
            Files.writeString(store.stateFile(root), "[]");

            assertThrows(StateCorruptedException.class, () -> store.load(root));
        }

        @Test
        @DisplayName("unknown phase names are rejected")
        void unknownPhase() throws IOException {
            Files.writeString(store.stateFile(root), """
                    {"schemaVersion": 2, "featureId": "001-login", "currentPhase": "deploy",
                     "completedPhases": [], "skippedPhases": [], "mode": "staged",
                     "startedAt": "2026-03-01T10:00:00Z", "lastUpdated": "2026-03-01T10:00:00Z",
                     "checkpoints": {}}
                    """);

            assertThrows(StateCorruptedException.class, () -> store.load(root));
        }

        @Test
        @DisplayName("out-of-order completed phases are rejected")
        void outOfOrder() throws IOException {
            Files.writeString(store.stateFile(root), """
                    {"schemaVersion": 2, "featureId": "001-login", "currentPhase": "clarify",
                     "completedPhases": ["specify", "principles"], "skippedPhases": [], "mode": "staged",
                     "startedAt": "2026-03-01T10:00:00Z", "lastUpdated": "2026-03-01T10:00:00Z",
                     "checkpoints": {}}
                    """);

            var ex = assertThrows(StateCorruptedException.class, () -> store.load(root));
            assertTrue(ex.getMessage().contains("out of canonical order"), ex.getMessage());
        }

        @Test
        @DisplayName("a newer schema version is rejected")
        void newerSchema() throws IOException {
            Files.writeString(store.stateFile(root), "{\"schemaVersion\": 99, \"featureId\": \"001-login\"}");

            var ex = assertThrows(StateCorruptedException.class, () -> store.load(root));
            assertTrue(ex.getMessage().contains("newer version"), ex.getMessage());
        }
    }

    // -- Migration --

    @Test
    @DisplayName("a version 1 document is migrated on load")
    void migratesV1() throws IOException {
        Files.writeString(store.stateFile(root), """
                {"featureId": "001-login", "currentPhase": "clarify",
                 "completedPhases": ["principles", "specify"], "mode": "interactive",
                 "startedAt": "2026-03-01T10:00:00Z", "lastUpdated": "2026-03-01T10:05:00Z",
                 "checkpoints": {
                   "principles": {"status": "done", "tasksCompleted": 0, "tasksTotal": 0,
                                  "recordedAt": "2026-03-01T10:00:00Z"},
                   "specify": {"status": "done", "tasksCompleted": 0, "tasksTotal": 0,
                               "recordedAt": "2026-03-01T10:05:00Z"}
                 }}
                """);

        WorkflowState state = store.load(root).orElseThrow();

        assertEquals(WorkflowState.CURRENT_SCHEMA_VERSION, state.schemaVersion());
        assertEquals(Phase.CLARIFY, state.currentPhase());
        assertEquals(List.of(), state.skippedPhases());
        assertEquals(CheckpointStatus.COMPLETE, state.checkpoint(Phase.SPECIFY).orElseThrow().status());
    }

    // -- Delete and archive --

    @Test
    @DisplayName("delete removes the document and is a no-op when absent")
    void delete() {
        store.save(root, sampleState());

        store.delete(root);
        store.delete(root);

        assertFalse(Files.exists(store.stateFile(root)));
    }

    @Test
    @DisplayName("archive moves the document under the archive directory")
    void archive() throws IOException {
        WorkflowState state = sampleState();
        store.save(root, state);

        Path archived = store.archive(root, state, T1);

        assertFalse(Files.exists(store.stateFile(root)));
        assertEquals(root.resolve(".featureflow/archive/001-login-20260301-100500.json"), archived);
        assertTrue(Files.readString(archived).contains("\"featureId\" : \"001-login\""));
        assertEquals(Optional.empty(), store.load(root));
    }
}

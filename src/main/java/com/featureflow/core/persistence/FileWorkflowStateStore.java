package com.featureflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.featureflow.core.error.StateCorruptedException;
import com.featureflow.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link WorkflowStateStore} that keeps the state as one JSON document at the repository root.
 * <p>
 * Saves go to a temporary file in the same directory, are flushed to disk, and are then
 * renamed over the previous document. A crash before the rename leaves the previous
 * document untouched; leftover temporary files are never read.
 */
public class FileWorkflowStateStore implements WorkflowStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileWorkflowStateStore.class);

    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final WorkflowStateMigrator migrator;
    private final String stateFileName;
    private final String archiveDir;

    public FileWorkflowStateStore(ObjectMapper objectMapper, WorkflowStateMigrator migrator,
                                  String stateFileName, String archiveDir) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        this.migrator = Objects.requireNonNull(migrator, "WorkflowStateMigrator must not be null");
        this.stateFileName = stateFileName;
        this.archiveDir = archiveDir;
    }

    public Path stateFile(Path root) {
        return root.resolve(stateFileName);
    }

    @Override
    public Optional<WorkflowState> load(Path root) {
        Path file = stateFile(root);
        if (!Files.exists(file)) {
            return Optional.empty();
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workflow state " + file, e);
        }

        JsonNode tree;
        try {
            tree = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new StateCorruptedException(file, "invalid JSON (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse workflow state " + file, e);
        }
        if (!(tree instanceof ObjectNode document)) {
            throw new StateCorruptedException(file, "top-level value is not a JSON object", null);
        }

        WorkflowState state;
        try {
            state = objectMapper.treeToValue(migrator.migrate(document, file), WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptedException(file, e.getOriginalMessage(), e);
        }

        var violations = state.violations();
        if (!violations.isEmpty()) {
            throw new StateCorruptedException(file, String.join("; ", violations), null);
        }
        log.debug("Loaded workflow state for {} at phase {}", state.featureId(), state.currentPhase().id());
        return Optional.of(state);
    }

    @Override
    public void save(Path root, WorkflowState state) {
        Path target = stateFile(root);
        Path temp = null;
        try {
            Path dir = target.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);

            temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            commit(temp, target);
            temp = null;
            log.debug("Saved workflow state for {} (phase {})", state.featureId(), state.currentPhase().id());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save workflow state " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Moves a fully written temporary file over the target. Atomic where the file system allows it.
     */
    protected void commit(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}; falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void delete(Path root) {
        Path file = stateFile(root);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted workflow state {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete workflow state " + file, e);
        }
    }

    @Override
    public Path archive(Path root, WorkflowState state, Instant now) {
        Path file = stateFile(root);
        Path destination = root.resolve(archiveDir)
                .resolve(state.featureId() + "-" + ARCHIVE_STAMP.format(now) + ".json");
        try {
            Files.createDirectories(destination.getParent());
            if (Files.exists(file)) {
                Files.move(file, destination, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.write(destination, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
            }
            log.info("Archived workflow state for {} to {}", state.featureId(), destination);
            return destination;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to archive workflow state " + file, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}: {}", temp, e.getMessage());
        }
    }
}

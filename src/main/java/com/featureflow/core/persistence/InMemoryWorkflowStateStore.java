package com.featureflow.core.persistence;

import com.featureflow.core.state.WorkflowState;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link WorkflowStateStore} keyed by repository root. Counts writes so
 * callers can observe how often state was persisted.
 */
public class InMemoryWorkflowStateStore implements WorkflowStateStore {

    private final Map<Path, WorkflowState> states = new ConcurrentHashMap<>();
    private final List<WorkflowState> archived = new ArrayList<>();
    private int saveCount;

    @Override
    public Optional<WorkflowState> load(Path root) {
        return Optional.ofNullable(states.get(key(root)));
    }

    @Override
    public void save(Path root, WorkflowState state) {
        states.put(key(root), state);
        saveCount++;
    }

    @Override
    public void delete(Path root) {
        states.remove(key(root));
    }

    @Override
    public Path archive(Path root, WorkflowState state, Instant now) {
        states.remove(key(root));
        archived.add(state);
        return key(root).resolve("archive").resolve(state.featureId() + ".json");
    }

    public int saveCount() {
        return saveCount;
    }

    public List<WorkflowState> archived() {
        return List.copyOf(archived);
    }

    private static Path key(Path root) {
        return root.toAbsolutePath().normalize();
    }
}

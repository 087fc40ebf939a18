package com.featureflow.core.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where the workflow is running. Recomputed on every invocation, never cached.
 *
 * @param root              repository root
 * @param hasVersionControl whether a git work tree was detected
 * @param currentBranch     checked-out branch, {@code null} without version control
 * @param activeFeatureId   explicit feature override supplied by the caller or environment
 */
public record RepositoryContext(
    Path root,
    boolean hasVersionControl,
    String currentBranch,
    String activeFeatureId
) {

    public static RepositoryContext of(Path root) {
        return new RepositoryContext(root, false, null, null);
    }

    public Optional<String> branch() {
        return Optional.ofNullable(currentBranch).filter(b -> !b.isBlank());
    }

    public Optional<String> featureOverride() {
        return Optional.ofNullable(activeFeatureId).filter(f -> !f.isBlank());
    }

    public RepositoryContext withFeatureOverride(String featureId) {
        return new RepositoryContext(root, hasVersionControl, currentBranch, featureId);
    }
}

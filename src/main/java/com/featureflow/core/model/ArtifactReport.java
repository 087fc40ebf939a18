package com.featureflow.core.model;

import java.nio.file.Files;
import java.util.List;
import java.util.Map;

/**
 * Result of a validating resolve: paths plus per-kind presence.
 *
 * @param artifacts     resolved paths
 * @param present       presence per kind, as observed when the report was built
 * @param availableDocs every present kind, in declaration order
 */
public record ArtifactReport(
    ArtifactSet artifacts,
    Map<ArtifactKind, Boolean> present,
    List<ArtifactKind> availableDocs
) {

    public boolean isPresent(ArtifactKind kind) {
        return Boolean.TRUE.equals(present.get(kind));
    }

    public boolean featureDirectoryExists() {
        return Files.isDirectory(artifacts.featureDirectory());
    }
}

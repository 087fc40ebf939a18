package com.featureflow.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Canonical artifact paths for one feature. Holds paths only; existence is
 * queried live from the file system.
 */
public record ArtifactSet(
    Path repositoryRoot,
    Feature feature,
    Map<ArtifactKind, Path> paths
) {

    public ArtifactSet {
        paths = Collections.unmodifiableMap(new EnumMap<>(paths));
    }

    public Path featureDirectory() {
        return feature.directoryPath();
    }

    public Path path(ArtifactKind kind) {
        return paths.get(kind);
    }
}

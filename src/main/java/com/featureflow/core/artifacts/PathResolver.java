package com.featureflow.core.artifacts;

import com.featureflow.core.config.FeatureflowProperties;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactReport;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.RepositoryContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a repository root and feature to the canonical artifact paths.
 * <p>
 * Never writes. {@link #resolve} does not touch the file system at all, so it can be
 * used before the feature directory exists; {@link #inspect} additionally reports
 * which artifacts are present.
 */
@Service
public class PathResolver {

    private final String specsDir;

    @Autowired
    public PathResolver(FeatureflowProperties properties) {
        this(properties.getSpecsDir());
    }

    public PathResolver(String specsDir) {
        this.specsDir = specsDir;
    }

    /** Directory holding every feature directory, e.g. {@code <root>/specs}. */
    public Path specsRoot(Path repositoryRoot) {
        return repositoryRoot.resolve(specsDir).toAbsolutePath().normalize();
    }

    public Path featureDirectory(Path repositoryRoot, String featureId) {
        return specsRoot(repositoryRoot).resolve(featureId);
    }

    /** Paths-only mode. */
    public ArtifactSet resolve(RepositoryContext context, Feature feature) {
        Path dir = feature.directoryPath() != null
                ? feature.directoryPath()
                : featureDirectory(context.root(), feature.id());
        var paths = new EnumMap<ArtifactKind, Path>(ArtifactKind.class);
        for (ArtifactKind kind : ArtifactKind.values()) {
            paths.put(kind, dir.resolve(kind.fileName()));
        }
        Feature located = feature.directoryPath() != null
                ? feature
                : new Feature(feature.number(), feature.slug(), feature.branchName(), dir);
        return new ArtifactSet(context.root(), located, paths);
    }

    /** Validating mode: paths plus live per-kind presence. */
    public ArtifactReport inspect(RepositoryContext context, Feature feature) {
        return inspect(resolve(context, feature));
    }

    public ArtifactReport inspect(ArtifactSet artifacts) {
        var present = new EnumMap<ArtifactKind, Boolean>(ArtifactKind.class);
        var available = new ArrayList<ArtifactKind>();
        for (Map.Entry<ArtifactKind, Path> entry : artifacts.paths().entrySet()) {
            boolean exists = isPresent(entry.getKey(), entry.getValue());
            present.put(entry.getKey(), exists);
            if (exists) {
                available.add(entry.getKey());
            }
        }
        return new ArtifactReport(artifacts, present, available);
    }

    /**
     * Files count when they exist as regular files. Directory-valued kinds count only
     * when the directory exists and has at least one entry.
     */
    public static boolean isPresent(ArtifactKind kind, Path path) {
        if (!kind.isDirectory()) {
            return Files.isRegularFile(path);
        }
        if (!Files.isDirectory(path)) {
            return false;
        }
        try (var entries = Files.list(path)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + path, e);
        }
    }
}

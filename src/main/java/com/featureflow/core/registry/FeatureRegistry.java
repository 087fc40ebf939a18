package com.featureflow.core.registry;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.config.FeatureflowProperties;
import com.featureflow.core.error.AmbiguousFeatureException;
import com.featureflow.core.error.NoFeatureContextException;
import com.featureflow.core.events.EventBus;
import com.featureflow.core.events.WorkflowEvent;
import com.featureflow.core.metrics.WorkflowMetrics;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.vcs.GitCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Allocates feature numbers and works out which feature the caller is on.
 * <p>
 * Numbers come from the highest of: existing feature directories, branch names
 * (local and remote) and the highest number this process has already handed out
 * for the same root. No inter-process lock is taken; two concurrent allocations
 * in one repository may collide.
 */
@Service
public class FeatureRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeatureRegistry.class);

    private final PathResolver pathResolver;
    private final GitCli git;
    private final WorkflowMetrics metrics;
    private final EventBus eventBus;
    private final int slugWordLimit;

    /** Highest number handed out per repository root during this process. */
    private final Map<Path, Integer> highWaterMarks = new ConcurrentHashMap<>();

    @Autowired
    public FeatureRegistry(PathResolver pathResolver, GitCli git, WorkflowMetrics metrics,
                           EventBus eventBus, FeatureflowProperties properties) {
        this(pathResolver, git, metrics, eventBus, properties.getSlugWordLimit());
    }

    public FeatureRegistry(PathResolver pathResolver, GitCli git, WorkflowMetrics metrics,
                           EventBus eventBus, int slugWordLimit) {
        this.pathResolver = pathResolver;
        this.git = git;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.slugWordLimit = slugWordLimit;
    }

    public Feature allocate(RepositoryContext context, String description) {
        return allocate(context, description, null);
    }

    /**
     * Allocates the next feature, creates its directory and, under version control,
     * creates and checks out its branch.
     *
     * @param shortName optional explicit name; slugged without a word limit when given
     */
    public Feature allocate(RepositoryContext context, String description, String shortName) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Feature description must not be blank");
        }
        Path root = key(context.root());
        Path specsRoot = pathResolver.specsRoot(root);

        int highest = Math.max(highestDirectoryNumber(specsRoot), highWaterMarks.getOrDefault(root, 0));
        if (context.hasVersionControl()) {
            highest = Math.max(highest, highestBranchNumber(root));
        }
        int next = highest + 1;

        String slug = shortName != null && !shortName.isBlank()
                ? SlugGenerator.slug(shortName, 0)
                : SlugGenerator.slug(description, slugWordLimit);
        Feature feature = Feature.of(next, slug, specsRoot);

        if (context.hasVersionControl()) {
            git.createBranch(root, feature.branchName());
        } else {
            log.warn("Git repository not detected; skipped branch creation for {}", feature.branchName());
        }

        try {
            Files.createDirectories(feature.directoryPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create feature directory " + feature.directoryPath(), e);
        }
        highWaterMarks.merge(root, next, Math::max);

        log.info("Allocated feature {} at {}", feature.id(), feature.directoryPath());
        metrics.recordFeatureAllocated();
        eventBus.publish(new WorkflowEvent("feature.allocated", feature.id(), null,
                Map.of("number", feature.number(), "slug", feature.slug(),
                        "directory", feature.directoryPath().toString()),
                Instant.now()));
        return feature;
    }

    /**
     * Resolves the active feature: explicit override first, then a numbered branch,
     * then the single highest-numbered feature directory.
     *
     * @throws NoFeatureContextException  if nothing identifies a feature
     * @throws AmbiguousFeatureException  if the highest number, or a prefix, matches several directories
     */
    public Feature resolveCurrent(RepositoryContext context) {
        Path root = key(context.root());

        var override = context.featureOverride();
        if (override.isPresent()) {
            String id = override.get().trim();
            if (!Feature.isFeatureId(id)) {
                throw new NoFeatureContextException(
                        "Feature override '" + id + "' is not of the form NNN-name (e.g. 001-my-feature)");
            }
            log.debug("Using feature override {}", id);
            return find(root, id);
        }

        var branch = context.branch().filter(Feature::isFeatureId);
        if (branch.isPresent()) {
            log.debug("Using feature branch {}", branch.get());
            return find(root, branch.get());
        }

        List<Feature> features = listFeatures(root);
        if (features.isEmpty()) {
            throw new NoFeatureContextException(context.branch()
                    .map(b -> "Not on a feature branch (current branch: " + b + ") and no feature directories under "
                            + pathResolver.specsRoot(root))
                    .orElse("No feature override, feature branch or feature directory under "
                            + pathResolver.specsRoot(root)));
        }
        int highest = features.get(features.size() - 1).numericValue();
        List<Feature> top = features.stream().filter(f -> f.numericValue() == highest).toList();
        if (top.size() > 1) {
            throw new AmbiguousFeatureException(
                    "Several feature directories share the highest number " + Feature.formatNumber(highest),
                    top.stream().map(Feature::id).toList());
        }
        return top.get(0);
    }

    /**
     * Locates the directory for a feature identifier by its numeric prefix, so that
     * several branches ({@code 004-fix-bug}, {@code 004-add-tests}) can share one
     * feature directory. Falls back to the exact identifier when no directory matches.
     */
    public Feature find(Path root, String featureId) {
        Matcher m = Feature.ID_PATTERN.matcher(featureId);
        if (!m.matches()) {
            throw new NoFeatureContextException("Not a feature identifier: " + featureId);
        }
        String prefix = m.group(1) + "-";
        List<Feature> matches = listFeatures(root).stream()
                .filter(f -> f.id().startsWith(prefix))
                .toList();
        if (matches.size() == 1) {
            return matches.get(0);
        }
        if (matches.size() > 1) {
            log.warn("Multiple feature directories found with prefix '{}': {}", m.group(1),
                    matches.stream().map(Feature::id).collect(Collectors.joining(", ")));
            throw new AmbiguousFeatureException(
                    "Multiple feature directories found with prefix '" + m.group(1) + "'",
                    matches.stream().map(Feature::id).toList());
        }
        return Feature.fromId(featureId, pathResolver.featureDirectory(root, featureId));
    }

    /** Every numbered feature directory, ordered by number then name. */
    public List<Feature> listFeatures(Path root) {
        Path specsRoot = pathResolver.specsRoot(key(root));
        if (!Files.isDirectory(specsRoot)) {
            return List.of();
        }
        var features = new ArrayList<Feature>();
        try (var entries = Files.list(specsRoot)) {
            entries.filter(Files::isDirectory)
                    .forEach(dir -> {
                        String name = dir.getFileName().toString();
                        if (Feature.isFeatureId(name)) {
                            features.add(Feature.fromId(name, dir));
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + specsRoot, e);
        }
        features.sort(Comparator.comparingInt(Feature::numericValue).thenComparing(Feature::id));
        return features;
    }

    private int highestDirectoryNumber(Path specsRoot) {
        if (!Files.isDirectory(specsRoot)) {
            return 0;
        }
        try (var entries = Files.list(specsRoot)) {
            return entries.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .mapToInt(FeatureRegistry::leadingNumber)
                    .max()
                    .orElse(0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + specsRoot, e);
        }
    }

    private int highestBranchNumber(Path root) {
        return git.listBranches(root).stream()
                .mapToInt(FeatureRegistry::leadingNumber)
                .max()
                .orElse(0);
    }

    private static int leadingNumber(String name) {
        Matcher m = Feature.ID_PATTERN.matcher(name);
        return m.matches() ? Integer.parseInt(m.group(1)) : 0;
    }

    private static Path key(Path root) {
        return root.toAbsolutePath().normalize();
    }
}

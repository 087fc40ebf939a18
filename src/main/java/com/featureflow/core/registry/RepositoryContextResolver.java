package com.featureflow.core.registry;

import com.featureflow.core.config.FeatureflowProperties;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.vcs.GitCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Builds a fresh {@link RepositoryContext} for each invocation.
 * <p>
 * The root is git's top-level directory when git knows the working directory;
 * otherwise the nearest ancestor holding one of the configured markers, and
 * failing that the working directory itself. The feature override is read from
 * the configured environment variable unless the caller passes one explicitly.
 */
@Service
public class RepositoryContextResolver {

    private static final Logger log = LoggerFactory.getLogger(RepositoryContextResolver.class);

    private final GitCli git;
    private final List<String> markers;
    private final String overrideVariable;
    private final UnaryOperator<String> environment;

    @Autowired
    public RepositoryContextResolver(GitCli git, FeatureflowProperties properties) {
        this(git, properties.getRootMarkers(), properties.getOverrideVariable(), System::getenv);
    }

    public RepositoryContextResolver(GitCli git, List<String> markers, String overrideVariable,
                                     UnaryOperator<String> environment) {
        this.git = git;
        this.markers = List.copyOf(markers);
        this.overrideVariable = overrideVariable;
        this.environment = environment;
    }

    public RepositoryContext resolve(Path workingDirectory) {
        return resolve(workingDirectory, null);
    }

    /**
     * @param explicitFeature feature identifier supplied by the caller; wins over the environment
     */
    public RepositoryContext resolve(Path workingDirectory, String explicitFeature) {
        Path start = workingDirectory.toAbsolutePath().normalize();
        String override = explicitFeature != null && !explicitFeature.isBlank()
                ? explicitFeature.trim()
                : environment.apply(overrideVariable);

        Optional<Path> topLevel = git.topLevel(start);
        if (topLevel.isPresent()) {
            Path root = topLevel.get().toAbsolutePath().normalize();
            String branch = git.currentBranch(root).orElse(null);
            log.debug("Repository root {} (git, branch {})", root, branch);
            return new RepositoryContext(root, true, branch, override);
        }

        Path root = findMarkedAncestor(start).orElseGet(() -> {
            log.debug("No repository marker above {}; using it as the root", start);
            return start;
        });
        log.debug("Repository root {} (no git)", root);
        return new RepositoryContext(root, false, null, override);
    }

    Optional<Path> findMarkedAncestor(Path start) {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            for (String marker : markers) {
                if (Files.exists(dir.resolve(marker))) {
                    return Optional.of(dir);
                }
            }
        }
        return Optional.empty();
    }
}

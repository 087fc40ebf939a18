package com.featureflow.core.health;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.config.FeatureflowProperties;
import com.featureflow.core.error.StateCorruptedException;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.persistence.WorkflowStateStore;
import com.featureflow.core.registry.RepositoryContextResolver;
import com.featureflow.core.vcs.GitCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitCli git;
    private final RepositoryContextResolver contextResolver;
    private final PathResolver pathResolver;
    private final WorkflowStateStore store;
    private final String templatesDir;

    public HealthCheckService(GitCli git, RepositoryContextResolver contextResolver, PathResolver pathResolver,
                              WorkflowStateStore store, FeatureflowProperties properties) {
        this.git = git;
        this.contextResolver = contextResolver;
        this.pathResolver = pathResolver;
        this.store = store;
        this.templatesDir = properties.getTemplatesDir();
    }

    public List<HealthStatus> checkAll(Path workingDirectory) {
        var results = new ArrayList<HealthStatus>();
        RepositoryContext context = contextResolver.resolve(workingDirectory);
        results.add(checkGit(context));
        results.add(checkDirectory("specs", pathResolver.specsRoot(context.root()),
                "Created by the first create-feature"));
        results.add(checkDirectory("templates", context.root().resolve(templatesDir),
                "Artifacts will start out empty"));
        results.add(checkState(context.root()));
        return results;
    }

    private HealthStatus checkGit(RepositoryContext context) {
        if (!git.isAvailable()) {
            return new HealthStatus("git", HealthStatus.Status.DEGRADED,
                    "git not found; branches will not be created", Map.of());
        }
        if (!context.hasVersionControl()) {
            return new HealthStatus("git", HealthStatus.Status.DEGRADED,
                    "Not a git work tree: " + context.root(), Map.of("root", context.root().toString()));
        }
        return new HealthStatus("git", HealthStatus.Status.UP,
                "Work tree at " + context.root() + context.branch().map(b -> " on " + b).orElse(""),
                Map.of("root", context.root().toString()));
    }

    private HealthStatus checkDirectory(String component, Path dir, String consequence) {
        if (Files.isDirectory(dir)) {
            return new HealthStatus(component, HealthStatus.Status.UP, dir.toString(), Map.of());
        }
        return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                dir + " does not exist. " + consequence, Map.of());
    }

    private HealthStatus checkState(Path root) {
        try {
            return store.load(root)
                    .map(state -> new HealthStatus("state", HealthStatus.Status.UP,
                            "Workflow for " + state.featureId() + " at phase '" + state.currentPhase().id() + "'",
                            Map.of("featureId", state.featureId())))
                    .orElseGet(() -> new HealthStatus("state", HealthStatus.Status.UP,
                            "No workflow in progress", Map.of()));
        } catch (StateCorruptedException e) {
            log.warn("State health check failed: {}", e.getMessage());
            return new HealthStatus("state", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }
}

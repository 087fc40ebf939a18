package com.featureflow.dispatch.cli;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.registry.RepositoryContextResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow paths
 * <p>
 * Prints the artifact paths of the current feature without touching the file system.
 */
@Command(name = "paths", mixinStandardHelpOptions = true, description = "Show artifact paths for the current feature")
@Component
public class PathsCommand implements Callable<Integer> {

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final FeatureRegistry registry;
    private final PathResolver pathResolver;

    public PathsCommand(RepositoryContextResolver contextResolver, FeatureRegistry registry,
                        PathResolver pathResolver) {
        this.contextResolver = contextResolver;
        this.registry = registry;
        this.pathResolver = pathResolver;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        ArtifactSet artifacts = pathResolver.resolve(context, registry.resolveCurrent(context));
        Map<String, Object> body = describe(context, artifacts);
        if (options.json) {
            ConsoleOutput.json(body);
        } else {
            body.forEach(ConsoleOutput::field);
        }
        return 0;
    }

    static Map<String, Object> describe(RepositoryContext context, ArtifactSet artifacts) {
        var body = new LinkedHashMap<String, Object>();
        body.put("REPO_ROOT", context.root().toString());
        body.put("CURRENT_BRANCH", context.branch().orElse(artifacts.feature().id()));
        body.put("HAS_GIT", context.hasVersionControl());
        body.put("FEATURE", artifacts.feature().id());
        body.put("FEATURE_DIR", artifacts.featureDirectory().toString());
        body.put("FEATURE_SPEC", artifacts.path(ArtifactKind.SPEC).toString());
        body.put("IMPL_PLAN", artifacts.path(ArtifactKind.PLAN).toString());
        body.put("TASKS", artifacts.path(ArtifactKind.TASKS).toString());
        body.put("RESEARCH", artifacts.path(ArtifactKind.RESEARCH).toString());
        body.put("DATA_MODEL", artifacts.path(ArtifactKind.DATA_MODEL).toString());
        body.put("QUICKSTART", artifacts.path(ArtifactKind.QUICKSTART).toString());
        body.put("CONTRACTS_DIR", artifacts.path(ArtifactKind.CONTRACTS).toString());
        return body;
    }
}

package com.featureflow.dispatch.cli;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.error.MissingArtifactException;
import com.featureflow.core.gate.PrerequisiteGate;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.GateResult;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.registry.RepositoryContextResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow check
 * <p>
 * Verifies that the artifacts needed for the next step exist. The spec and plan are
 * required unless {@code --require} names a different set.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Check that required artifacts exist for the current feature")
@Component
public class CheckCommand implements Callable<Integer> {

    @Option(names = "--require", split = ",", paramLabel = "<kind>",
            description = "Artifact kinds to require (default: spec,plan). One of: spec, plan, research, dataModel, contracts, quickstart, tasks")
    private List<String> require;

    @Option(names = "--require-tasks", description = "Also require tasks.md")
    private boolean requireTasks;

    @Option(names = "--include-tasks", description = "List tasks.md among the available docs")
    private boolean includeTasks;

    @Mixin
    private CommonOptions options;

    @Spec
    private CommandSpec spec;

    private final RepositoryContextResolver contextResolver;
    private final FeatureRegistry registry;
    private final PathResolver pathResolver;
    private final PrerequisiteGate gate;

    public CheckCommand(RepositoryContextResolver contextResolver, FeatureRegistry registry,
                        PathResolver pathResolver, PrerequisiteGate gate) {
        this.contextResolver = contextResolver;
        this.registry = registry;
        this.pathResolver = pathResolver;
        this.gate = gate;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        ArtifactSet artifacts = pathResolver.resolve(context, registry.resolveCurrent(context));
        GateResult result = gate.check(requiredKinds(), artifacts);

        List<String> docs = new ArrayList<>();
        for (ArtifactKind kind : result.availableDocs()) {
            if (kind != ArtifactKind.TASKS || includeTasks) {
                docs.add(kind.docName());
            }
        }

        if (options.json) {
            var body = new LinkedHashMap<String, Object>();
            body.put("FEATURE_DIR", artifacts.featureDirectory().toString());
            body.put("AVAILABLE_DOCS", docs);
            body.put("MISSING", result.missing().stream().map(ArtifactKind::docName).toList());
            body.put("CLARIFICATION_MARKERS", result.clarificationMarkers());
            ConsoleOutput.json(body);
        } else {
            ConsoleOutput.field("FEATURE_DIR", artifacts.featureDirectory());
            System.out.println("AVAILABLE_DOCS:");
            docs.forEach(doc -> ConsoleOutput.doc(doc, true));
            if (includeTasks && !result.availableDocs().contains(ArtifactKind.TASKS)) {
                ConsoleOutput.doc(ArtifactKind.TASKS.docName(), false);
            }
            if (result.clarificationMarkers() > 0) {
                ConsoleOutput.warn(result.clarificationMarkers() + " open clarification marker(s) in spec.md");
            }
        }

        if (!result.passed()) {
            var missing = new MissingArtifactException(artifacts.featureDirectory(), result.missing());
            if (options.json) {
                return missing.exitCode();
            }
            throw missing;
        }
        return 0;
    }

    Set<ArtifactKind> requiredKinds() {
        Set<ArtifactKind> kinds = EnumSet.noneOf(ArtifactKind.class);
        if (require == null || require.isEmpty()) {
            kinds.add(ArtifactKind.SPEC);
            kinds.add(ArtifactKind.PLAN);
        } else {
            for (String id : require) {
                try {
                    kinds.add(ArtifactKind.fromId(id));
                } catch (IllegalArgumentException e) {
                    throw new ParameterException(spec.commandLine(), e.getMessage());
                }
            }
        }
        if (requireTasks) {
            kinds.add(ArtifactKind.TASKS);
        }
        return kinds;
    }
}

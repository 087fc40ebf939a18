package com.featureflow.dispatch.cli;

import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.Feature;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.registry.RepositoryContextResolver;
import com.featureflow.core.template.TemplateProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow create-feature &lt;description...&gt;
 * <p>
 * Allocates the next feature number, creates the feature directory and branch,
 * and seeds the spec from its template.
 */
@Command(name = "create-feature", mixinStandardHelpOptions = true,
        description = "Allocate a new numbered feature and scaffold its spec")
@Component
public class CreateFeatureCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "<description>", description = "What the feature is about")
    private List<String> description;

    @Option(names = {"--short-name", "--feature-name"}, paramLabel = "<name>",
            description = "Explicit short name for the branch, used instead of the first words of the description")
    private String shortName;

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final FeatureRegistry registry;
    private final TemplateProvider templates;

    public CreateFeatureCommand(RepositoryContextResolver contextResolver, FeatureRegistry registry,
                                TemplateProvider templates) {
        this.contextResolver = contextResolver;
        this.registry = registry;
        this.templates = templates;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory());
        Feature feature = registry.allocate(context, String.join(" ", description), shortName);
        Path specFile = feature.directoryPath().resolve(ArtifactKind.SPEC.fileName());
        templates.createFromTemplate(ArtifactKind.SPEC, specFile);

        if (options.json) {
            var body = new LinkedHashMap<String, Object>();
            body.put("BRANCH_NAME", feature.branchName());
            body.put("SPEC_FILE", specFile.toString());
            body.put("FEATURE_NUM", feature.number());
            body.put("FEATURE_DIR", feature.directoryPath().toString());
            body.put("HAS_GIT", context.hasVersionControl());
            ConsoleOutput.json(body);
        } else {
            ConsoleOutput.success("Created feature " + feature.id());
            ConsoleOutput.field("BRANCH_NAME", feature.branchName());
            ConsoleOutput.field("SPEC_FILE", specFile);
            ConsoleOutput.field("FEATURE_NUM", feature.number());
            ConsoleOutput.field("HAS_GIT", context.hasVersionControl());
            if (!context.hasVersionControl()) {
                ConsoleOutput.info("No git repository: set SPECIFY_FEATURE=" + feature.id()
                        + " or pass --feature to work on this feature");
            }
        }
        return 0;
    }
}

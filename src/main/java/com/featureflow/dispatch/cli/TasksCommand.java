package com.featureflow.dispatch.cli;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.error.MissingArtifactException;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.RepositoryContext;
import com.featureflow.core.model.TaskItem;
import com.featureflow.core.model.TaskProgress;
import com.featureflow.core.registry.FeatureRegistry;
import com.featureflow.core.registry.RepositoryContextResolver;
import com.featureflow.core.tasks.TaskProgressParser;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow tasks
 * <p>
 * Parses tasks.md of the current feature and shows each task with overall progress.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "Show task progress for the current feature")
@Component
public class TasksCommand implements Callable<Integer> {

    @Option(names = "--pending", description = "List only tasks that are not done yet")
    private boolean pendingOnly;

    @Mixin
    private CommonOptions options;

    private final RepositoryContextResolver contextResolver;
    private final FeatureRegistry registry;
    private final PathResolver pathResolver;
    private final TaskProgressParser parser;

    public TasksCommand(RepositoryContextResolver contextResolver, FeatureRegistry registry,
                        PathResolver pathResolver, TaskProgressParser parser) {
        this.contextResolver = contextResolver;
        this.registry = registry;
        this.pathResolver = pathResolver;
        this.parser = parser;
    }

    @Override
    public Integer call() {
        RepositoryContext context = contextResolver.resolve(options.workingDirectory(), options.feature);
        ArtifactSet artifacts = pathResolver.resolve(context, registry.resolveCurrent(context));
        Path tasksFile = artifacts.path(ArtifactKind.TASKS);
        if (!Files.isRegularFile(tasksFile)) {
            throw new MissingArtifactException(artifacts.featureDirectory(), List.of(ArtifactKind.TASKS));
        }

        List<TaskItem> items = parser.parse(tasksFile);
        TaskProgress progress = parser.computeProgress(items);
        List<TaskItem> shown = pendingOnly ? items.stream().filter(t -> !t.completed()).toList() : items;

        if (options.json) {
            var body = new LinkedHashMap<String, Object>();
            body.put("feature", artifacts.feature().id());
            body.put("progress", progress);
            body.put("tasks", shown);
            ConsoleOutput.json(body);
            return 0;
        }

        ConsoleOutput.info("Tasks for " + artifacts.feature().id());
        System.out.println();
        System.out.printf("  %-3s %-10s %-4s %-5s %s%n", "", "ID", "PAR", "STORY", "DESCRIPTION");
        System.out.println("  " + "-".repeat(64));
        for (TaskItem item : shown) {
            System.out.printf("  %-3s %-10s %-4s %-5s %s%n",
                    item.completed() ? "[x]" : "[ ]", item.id(), item.parallelEligible() ? "P" : "",
                    item.storyLabel() != null ? item.storyLabel() : "", truncate(item.text(), 48));
        }
        System.out.println();
        ConsoleOutput.progress(progress);
        if (progress.nextPending() != null) {
            ConsoleOutput.field("Next", progress.nextPending().id() + " " + progress.nextPending().text());
        }
        return 0;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}

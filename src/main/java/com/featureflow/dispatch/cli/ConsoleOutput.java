package com.featureflow.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.featureflow.core.config.FeatureflowConfig;
import com.featureflow.core.engine.WorkflowRun;
import com.featureflow.core.events.WorkflowEvent;
import com.featureflow.core.model.TaskProgress;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Featureflow CLI.
 */
public class ConsoleOutput {

    private static final ObjectMapper JSON = FeatureflowConfig.workflowObjectMapper();

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FEATUREFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FEATUREFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + label + ":|@ " + (value == null ? "-" : value)));
    }

    public static void doc(String name, boolean present) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                present ? "  @|fg(green) ✓|@ " + name : "  @|fg(red) ✗|@ " + name));
    }

    public static void progress(TaskProgress p) {
        int width = 20;
        int filled = p.total() == 0 ? 0 : p.completed() * width / p.total();
        String bar = "#".repeat(filled) + ".".repeat(width - filled);
        String color = p.finished() ? "fg(green)" : "fg(yellow)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  [@|" + color + " " + bar + "|@] " + p.completed() + "/" + p.total()
                        + " (" + p.percentage() + "%)"));
    }

    /** Live progress line for a workflow event. */
    public static void event(WorkflowEvent event) {
        String prefix = switch (event.eventType()) {
            case "feature.allocated" -> "@|fg(cyan) [FEATURE]|@";
            case "workflow.started" -> "@|fg(cyan) [WORKFLOW]|@";
            case "phase.started" -> "@|fg(blue) [PHASE]|@";
            case "phase.completed" -> "@|fg(green) [PHASE]|@";
            case "phase.skipped" -> "@|fg(white) [PHASE]|@";
            case "phase.failed", "phase.blocked" -> "@|fg(red),bold [PHASE]|@";
            case "workflow.paused" -> "@|bold,fg(yellow) [PAUSED]|@";
            case "workflow.completed" -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String what = event.eventType().substring(event.eventType().indexOf('.') + 1);
        String subject = event.phase() != null ? event.phase() : event.featureId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + " " + what));
    }

    public static void runResult(WorkflowRun run) {
        System.out.println("──────────────────────────────────");
        field("Feature", run.feature().id());
        field("Phase", run.phase() != null ? run.phase().id() : null);
        switch (run.outcome()) {
            case DONE -> success(run.message());
            case PAUSED, IN_PROGRESS -> info(run.message());
            case BLOCKED, FAILED -> error(run.message());
        }
        if (run.progress() != null && run.progress().total() > 0) {
            progress(run.progress());
        }
        if (run.archivedTo() != null) {
            field("State archived to", run.archivedTo());
        }
    }

    public static void json(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON output", e);
        }
    }
}

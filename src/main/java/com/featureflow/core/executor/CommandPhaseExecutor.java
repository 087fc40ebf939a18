package com.featureflow.core.executor;

import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command once per phase. The command line is split on whitespace
 * after substituting {@code {phase}}, {@code {feature}} and {@code {featureDir}};
 * artifact paths are passed in the environment as {@code FEATUREFLOW_<KIND>_FILE}.
 * Exit code 0 means success.
 */
public class CommandPhaseExecutor implements PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandPhaseExecutor.class);
    private static final int OUTPUT_TAIL_CHARS = 2000;

    private final String commandTemplate;
    private final Duration timeout;

    public CommandPhaseExecutor(String commandTemplate, Duration timeout) {
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("featureflow.executor.command must be set for the command executor");
        }
        this.commandTemplate = commandTemplate;
        this.timeout = timeout;
    }

    @Override
    public PhaseResult execute(Phase phase, ArtifactSet artifacts) {
        List<String> command = commandLine(phase, artifacts);
        log.info("Running phase {} command: {}", phase.id(), String.join(" ", command));

        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("featureflow-" + phase.id() + "-", ".log");
            var builder = new ProcessBuilder(command)
                    .directory(artifacts.repositoryRoot().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().putAll(environment(phase, artifacts));

            Process process = builder.start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return PhaseResult.failure("Command for phase " + phase.id() + " timed out after "
                        + timeout.toSeconds() + "s");
            }
            String output = tail(Files.readString(outputFile, StandardCharsets.UTF_8));
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return PhaseResult.failure("Command for phase " + phase.id() + " exited with code "
                        + exitCode + (output.isBlank() ? "" : ": " + output.strip()));
            }
            return PhaseResult.succeeded(Map.of("executor", "command",
                    "exitCode", String.valueOf(exitCode), "output", output));
        } catch (IOException e) {
            return PhaseResult.failure("Command for phase " + phase.id() + " could not be run: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PhaseResult.failure("Interrupted while running phase " + phase.id());
        } finally {
            deleteQuietly(outputFile);
        }
    }

    List<String> commandLine(Phase phase, ArtifactSet artifacts) {
        String expanded = commandTemplate
                .replace("{phase}", phase.id())
                .replace("{feature}", artifacts.feature().id())
                .replace("{featureDir}", artifacts.featureDirectory().toString());
        return Arrays.asList(expanded.trim().split("\\s+"));
    }

    static Map<String, String> environment(Phase phase, ArtifactSet artifacts) {
        var env = new LinkedHashMap<String, String>();
        env.put("FEATUREFLOW_PHASE", phase.id());
        env.put("FEATUREFLOW_FEATURE", artifacts.feature().id());
        env.put("FEATUREFLOW_FEATURE_DIR", artifacts.featureDirectory().toString());
        env.put("FEATUREFLOW_REPO_ROOT", artifacts.repositoryRoot().toString());
        for (ArtifactKind kind : ArtifactKind.values()) {
            env.put("FEATUREFLOW_" + kind.name().toUpperCase(Locale.ROOT) + "_FILE", artifacts.path(kind).toString());
        }
        return env;
    }

    private static String tail(String output) {
        return output.length() <= OUTPUT_TAIL_CHARS ? output : output.substring(output.length() - OUTPUT_TAIL_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}

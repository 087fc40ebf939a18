package com.featureflow.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Thin wrapper over the {@code git} command line, used for repository root
 * detection, branch context and feature branch creation.
 * <p>
 * Shells out via {@link ProcessBuilder}; a missing {@code git} binary is treated
 * the same as "not a repository".
 */
public class GitCli {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    private final String executable;

    public GitCli() {
        this("git");
    }

    public GitCli(String executable) {
        this.executable = executable;
    }

    /** Whether the git binary can be launched at all. */
    public boolean isAvailable() {
        return run(Path.of("."), "--version").map(r -> r.exitCode() == 0).orElse(false);
    }

    /** Top-level directory of the work tree containing {@code dir}, if any. */
    public Optional<Path> topLevel(Path dir) {
        return run(dir, "rev-parse", "--show-toplevel")
                .filter(r -> r.exitCode() == 0 && !r.output().isBlank())
                .map(r -> Path.of(r.output().trim()));
    }

    /** Checked-out branch name, empty outside a work tree or on a detached head. */
    public Optional<String> currentBranch(Path root) {
        return run(root, "rev-parse", "--abbrev-ref", "HEAD")
                .filter(r -> r.exitCode() == 0)
                .map(r -> r.output().trim())
                .filter(b -> !b.isEmpty() && !"HEAD".equals(b));
    }

    /**
     * Local and remote branch names with the {@code remotes/<remote>/} prefix removed,
     * de-duplicated, in the order git lists them.
     */
    public List<String> listBranches(Path root) {
        var result = run(root, "branch", "-a");
        if (result.isEmpty() || result.get().exitCode() != 0) {
            return List.of();
        }
        var names = new LinkedHashSet<String>();
        for (String line : result.get().output().split("\n")) {
            String name = cleanBranchName(line);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    /** Creates and checks out {@code branch}. */
    public void createBranch(Path root, String branch) {
        var result = run(root, "checkout", "-b", branch)
                .orElseThrow(() -> new IllegalStateException("git is not available"));
        if (result.exitCode() != 0) {
            throw new IllegalStateException("Failed to create branch '%s' (exit code %d): %s"
                    .formatted(branch, result.exitCode(), result.output().trim()));
        }
        log.info("Created and checked out branch '{}'", branch);
    }

    static String cleanBranchName(String line) {
        String name = line.strip();
        if (name.startsWith("* ") || name.startsWith("+ ")) {
            name = name.substring(2).strip();
        }
        if (name.contains(" -> ") || name.startsWith("(")) {
            return "";
        }
        if (name.startsWith("remotes/")) {
            int slash = name.indexOf('/', "remotes/".length());
            name = slash < 0 ? "" : name.substring(slash + 1);
        }
        return name;
    }

    /**
     * Runs git and captures combined output.
     *
     * @return the result, or empty when the git binary cannot be started
     */
    Optional<GitResult> run(Path workDir, String... args) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.debug("git could not be started: {}", e.getMessage());
            return Optional.empty();
        }

        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String output = reader.lines().collect(Collectors.joining("\n"));
            return Optional.of(new GitResult(process.waitFor(), output));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read output of " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    record GitResult(int exitCode, String output) {}
}

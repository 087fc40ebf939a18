package com.featureflow.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every subcommand.
 */
public class CommonOptions {

    @Option(names = "--json", description = "Print machine-readable JSON instead of narrative output")
    boolean json;

    @Option(names = "--root", paramLabel = "<dir>",
            description = "Directory to run in (default: current directory)")
    Path root;

    @Option(names = {"-f", "--feature"}, paramLabel = "<id>",
            description = "Feature identifier such as 001-my-feature; overrides the branch and SPECIFY_FEATURE")
    String feature;

    Path workingDirectory() {
        return (root != null ? root : Path.of("")).toAbsolutePath().normalize();
    }
}

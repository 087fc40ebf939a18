package com.featureflow.core.error;

import com.featureflow.core.model.ArtifactKind;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when required artifacts are absent. Lists every missing kind, not just the first.
 */
public class MissingArtifactException extends WorkflowException {

    private final List<ArtifactKind> missing;

    public MissingArtifactException(Path featureDirectory, List<ArtifactKind> missing) {
        super(ErrorKind.MISSING_ARTIFACT, describe(featureDirectory, missing));
        this.missing = List.copyOf(missing);
    }

    public List<ArtifactKind> missing() {
        return missing;
    }

    public static String describe(Path featureDirectory, List<ArtifactKind> missing) {
        return "Missing required artifacts in " + featureDirectory + ": "
                + missing.stream().map(ArtifactKind::docName).collect(Collectors.joining(", "));
    }
}

package com.featureflow.core.model;

import java.util.List;

/**
 * Outcome of a prerequisite check.
 *
 * @param availableDocs          every present kind, required or not
 * @param missing                every required kind that is absent
 * @param clarificationMarkers   unresolved clarification markers in the spec artifact
 */
public record GateResult(
    List<ArtifactKind> availableDocs,
    List<ArtifactKind> missing,
    int clarificationMarkers
) {

    public boolean passed() {
        return missing.isEmpty();
    }
}

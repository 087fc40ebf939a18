package com.featureflow.core.error;

import java.util.List;

/**
 * Thrown when several feature directories match and nothing disambiguates them.
 */
public class AmbiguousFeatureException extends WorkflowException {

    private final List<String> candidates;

    public AmbiguousFeatureException(String reason, List<String> candidates) {
        super(ErrorKind.AMBIGUOUS_FEATURE,
                reason + ": " + String.join(", ", candidates)
                        + ". Set the feature explicitly to choose one.");
        this.candidates = List.copyOf(candidates);
    }

    public List<String> candidates() {
        return candidates;
    }
}

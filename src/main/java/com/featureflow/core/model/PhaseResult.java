package com.featureflow.core.model;

import java.util.Map;

/**
 * What the phase executor reports back for one step.
 *
 * @param success  whether the phase produced its outputs
 * @param metadata free-form details from the executor
 * @param reason   failure reason; {@code null} on success
 */
public record PhaseResult(
    boolean success,
    Map<String, String> metadata,
    String reason
) {

    public static PhaseResult succeeded() {
        return new PhaseResult(true, Map.of(), null);
    }

    public static PhaseResult succeeded(Map<String, String> metadata) {
        return new PhaseResult(true, Map.copyOf(metadata), null);
    }

    public static PhaseResult failure(String reason) {
        return new PhaseResult(false, Map.of(), reason);
    }
}

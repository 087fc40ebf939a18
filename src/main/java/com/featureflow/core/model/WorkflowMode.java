package com.featureflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Determines where the orchestrator stops for an explicit continue signal.
 */
public enum WorkflowMode {
    /** Pause before every phase. */
    @JsonProperty("interactive")
    INTERACTIVE,
    /** Run through task generation without pausing, then pause before implementation. */
    @JsonProperty("staged")
    STAGED,
    /** Run to the terminal phase without pausing. */
    @JsonProperty("unattended")
    UNATTENDED;

    public boolean pausesBefore(Phase phase) {
        return switch (this) {
            case INTERACTIVE -> !phase.isTerminal();
            case STAGED -> phase == Phase.IMPLEMENT;
            case UNATTENDED -> false;
        };
    }
}

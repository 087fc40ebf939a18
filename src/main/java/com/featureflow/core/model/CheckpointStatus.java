package com.featureflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status recorded for a phase checkpoint.
 */
public enum CheckpointStatus {
    @JsonProperty("in_progress")
    IN_PROGRESS,
    @JsonProperty("complete")
    COMPLETE,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("skipped")
    SKIPPED
}

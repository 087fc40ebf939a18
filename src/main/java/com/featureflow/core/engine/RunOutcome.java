package com.featureflow.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a start or resume left the workflow.
 */
public enum RunOutcome {
    /** Waiting for a continue signal before the next phase. */
    @JsonProperty("paused")
    PAUSED,
    /** The next phase's inputs are missing. */
    @JsonProperty("blocked")
    BLOCKED,
    /** The executor reported a failure; resuming retries the same phase. */
    @JsonProperty("failed")
    FAILED,
    /** Implementation ran but tasks remain open. */
    @JsonProperty("in_progress")
    IN_PROGRESS,
    @JsonProperty("done")
    DONE
}

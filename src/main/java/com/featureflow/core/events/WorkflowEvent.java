package com.featureflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a feature moves through its phases, used for live CLI progress.
 *
 * @param eventType event type (e.g. "feature.allocated", "phase.started", "workflow.paused")
 * @param featureId the feature this event belongs to
 * @param phase     phase id the event relates to (nullable for workflow-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WorkflowEvent(
    String eventType,
    String featureId,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}

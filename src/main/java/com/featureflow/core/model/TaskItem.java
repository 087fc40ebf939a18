package com.featureflow.core.model;

/**
 * One checkbox line of a tasks artifact. Recomputed on every read, never persisted.
 *
 * @param id               explicit identifier ("T001") or a synthetic one ("TASK-001")
 * @param text             free text after all markers
 * @param completed        whether the box is ticked
 * @param parallelEligible whether the line carries the {@code [P]} marker
 * @param storyLabel       user-story label such as "US1", or {@code null}
 * @param lineNumber       1-based line number in the artifact
 */
public record TaskItem(
    String id,
    String text,
    boolean completed,
    boolean parallelEligible,
    String storyLabel,
    int lineNumber
) {}

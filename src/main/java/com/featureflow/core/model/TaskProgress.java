package com.featureflow.core.model;

/**
 * Aggregate completion of a task list.
 *
 * @param completed   ticked items
 * @param total       all items
 * @param percentage  floor of completed * 100 / total; 0 for an empty list
 * @param nextPending first incomplete item in document order, {@code null} when none
 */
public record TaskProgress(
    int completed,
    int total,
    int percentage,
    TaskItem nextPending
) {

    public static final TaskProgress EMPTY = new TaskProgress(0, 0, 0, null);

    public boolean finished() {
        return total > 0 && completed == total;
    }
}

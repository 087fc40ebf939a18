package com.featureflow.core.tasks;

/**
 * Token kinds of a task line, in the order they may appear.
 */
public enum TaskTokenType {
    /** {@code [ ]} pending, {@code [x]} or {@code [X]} complete. */
    CHECKBOX,
    /** {@code T001} or {@code [T001]}. */
    IDENTIFIER,
    /** {@code [P]}: may run in parallel with neighbouring tasks. */
    PARALLEL_MARKER,
    /** {@code [US1]}: the user story the task belongs to. */
    STORY_MARKER,
    TEXT
}

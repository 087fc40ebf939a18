package com.featureflow.core.tasks;

/**
 * @param type  token kind
 * @param value token text without brackets; for a checkbox, the character between them
 */
public record TaskToken(TaskTokenType type, String value) {

    public boolean isCompletedCheckbox() {
        return type == TaskTokenType.CHECKBOX && "x".equalsIgnoreCase(value);
    }
}

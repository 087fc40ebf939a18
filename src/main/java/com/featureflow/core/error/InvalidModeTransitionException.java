package com.featureflow.core.error;

/**
 * Thrown when a requested workflow transition is not allowed from the current state.
 */
public class InvalidModeTransitionException extends WorkflowException {
    public InvalidModeTransitionException(String message) {
        super(ErrorKind.INVALID_MODE_TRANSITION, message);
    }
}

package com.featureflow.core.error;

/**
 * Failure categories surfaced to callers, each with its own process exit code.
 */
public enum ErrorKind {
    NO_FEATURE_CONTEXT(3),
    AMBIGUOUS_FEATURE(4),
    MISSING_ARTIFACT(5),
    STATE_CORRUPTED(6),
    PHASE_EXECUTION_FAILED(7),
    INVALID_MODE_TRANSITION(8);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}

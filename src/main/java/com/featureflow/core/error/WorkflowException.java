package com.featureflow.core.error;

/**
 * Base type for every failure the workflow engine reports to its caller.
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;

    protected WorkflowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkflowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int exitCode() {
        return kind.exitCode();
    }
}

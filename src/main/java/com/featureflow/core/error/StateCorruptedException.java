package com.featureflow.core.error;

import java.nio.file.Path;

/**
 * Thrown when the workflow state file cannot be read back. The file is left
 * untouched; the user decides whether to repair or reset it.
 */
public class StateCorruptedException extends WorkflowException {

    private final Path stateFile;

    public StateCorruptedException(Path stateFile, String detail, Throwable cause) {
        super(ErrorKind.STATE_CORRUPTED,
                "Workflow state file " + stateFile + " is unreadable: " + detail
                        + ". Fix it by hand or delete it to reset the workflow.", cause);
        this.stateFile = stateFile;
    }

    public Path stateFile() {
        return stateFile;
    }
}

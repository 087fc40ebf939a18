package com.featureflow.core.error;

import com.featureflow.core.model.Phase;

/**
 * Raised to the CLI when a phase executor reported failure. Recoverable: resuming
 * re-enters the same phase.
 */
public class PhaseExecutionFailedException extends WorkflowException {

    private final Phase phase;
    private final String reason;

    public PhaseExecutionFailedException(Phase phase, String reason) {
        super(ErrorKind.PHASE_EXECUTION_FAILED, "Phase '" + phase.id() + "' failed: " + reason);
        this.phase = phase;
        this.reason = reason;
    }

    public Phase phase() {
        return phase;
    }

    public String reason() {
        return reason;
    }
}

package com.featureflow.core.executor;

import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseResult;

/**
 * Does the actual work of a phase: writing the spec, the plan, the task list,
 * or the code. Opaque to the orchestrator, which calls it once per step and
 * blocks until it returns.
 */
@FunctionalInterface
public interface PhaseExecutor {

    PhaseResult execute(Phase phase, ArtifactSet artifacts);
}

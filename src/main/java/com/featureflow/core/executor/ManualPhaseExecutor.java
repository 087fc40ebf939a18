package com.featureflow.core.executor;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.Phase;
import com.featureflow.core.model.PhaseResult;
import com.featureflow.core.template.TemplateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;

/**
 * Executor for work done out of band by a person or an assistant: it succeeds once
 * the phase's outputs exist and no longer hold the bare template, and otherwise
 * fails with instructions, so a later resume picks the phase up again.
 */
public class ManualPhaseExecutor implements PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(ManualPhaseExecutor.class);

    private final TemplateProvider templates;

    public ManualPhaseExecutor(TemplateProvider templates) {
        this.templates = templates;
    }

    @Override
    public PhaseResult execute(Phase phase, ArtifactSet artifacts) {
        var problems = new ArrayList<String>();
        for (ArtifactKind kind : phase.outputs()) {
            Path path = artifacts.path(kind);
            if (!PathResolver.isPresent(kind, path)) {
                problems.add(kind.docName() + " is missing");
            } else if (templates.isUnedited(kind, path)) {
                problems.add(kind.docName() + " has not been filled in yet");
            }
        }
        if (!problems.isEmpty()) {
            log.info("Phase {} awaits manual work: {}", phase.id(), problems);
            return PhaseResult.failure(String.join("; ", problems)
                    + ". Complete the " + phase.id() + " phase in " + artifacts.featureDirectory()
                    + " and resume.");
        }
        return PhaseResult.succeeded(Map.of("executor", "manual"));
    }
}

package com.featureflow.core.gate;

import com.featureflow.core.artifacts.PathResolver;
import com.featureflow.core.error.MissingArtifactException;
import com.featureflow.core.model.ArtifactKind;
import com.featureflow.core.model.ArtifactReport;
import com.featureflow.core.model.ArtifactSet;
import com.featureflow.core.model.GateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;

/**
 * Decides whether the artifacts a phase depends on are on disk. Read-only.
 */
@Service
public class PrerequisiteGate {

    private static final Logger log = LoggerFactory.getLogger(PrerequisiteGate.class);

    /** Prefix of the marker left in a spec wherever a question is still open. */
    public static final String CLARIFICATION_MARKER = "[NEEDS CLARIFICATION";

    private final PathResolver pathResolver;

    public PrerequisiteGate(PathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    /**
     * Checks every required kind in one pass.
     *
     * @return every missing required kind, every present kind (required or not) and the
     *         open clarification count of the spec
     */
    public GateResult check(Collection<ArtifactKind> required, ArtifactSet artifacts) {
        ArtifactReport report = pathResolver.inspect(artifacts);
        var missing = new ArrayList<ArtifactKind>();
        for (ArtifactKind kind : sorted(required)) {
            if (!report.isPresent(kind)) {
                missing.add(kind);
            }
        }
        int markers = report.isPresent(ArtifactKind.SPEC)
                ? countClarificationMarkers(artifacts.path(ArtifactKind.SPEC))
                : 0;
        if (!missing.isEmpty()) {
            log.debug("Gate failed for {}: missing {}", artifacts.feature().id(), missing);
        }
        return new GateResult(report.availableDocs(), missing, markers);
    }

    /**
     * Same as {@link #check} but fails instead of reporting.
     *
     * @throws MissingArtifactException listing every missing kind
     */
    public GateResult requireAll(Collection<ArtifactKind> required, ArtifactSet artifacts) {
        GateResult result = check(required, artifacts);
        if (!result.passed()) {
            throw new MissingArtifactException(artifacts.featureDirectory(), result.missing());
        }
        return result;
    }

    public static int countClarificationMarkers(Path spec) {
        if (!Files.isRegularFile(spec)) {
            return 0;
        }
        try {
            return countClarificationMarkers(Files.readString(spec, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + spec, e);
        }
    }

    public static int countClarificationMarkers(String text) {
        int count = 0;
        for (int i = text.indexOf(CLARIFICATION_MARKER); i >= 0;
             i = text.indexOf(CLARIFICATION_MARKER, i + CLARIFICATION_MARKER.length())) {
            count++;
        }
        return count;
    }

    private static EnumSet<ArtifactKind> sorted(Collection<ArtifactKind> kinds) {
        return kinds.isEmpty() ? EnumSet.noneOf(ArtifactKind.class) : EnumSet.copyOf(kinds);
    }
}

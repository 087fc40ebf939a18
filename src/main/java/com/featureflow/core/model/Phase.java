package com.featureflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered phases a feature moves through, from project principles to implementation.
 * <p>
 * Declaration order is the canonical order. Each phase names the artifacts it
 * produces; the inputs of a phase are the outputs of every phase before it.
 */
public enum Phase {
    @JsonProperty("principles")
    PRINCIPLES(false),
    @JsonProperty("specify")
    SPECIFY(false, ArtifactKind.SPEC),
    @JsonProperty("clarify")
    CLARIFY(true),
    @JsonProperty("plan")
    PLAN(false, ArtifactKind.PLAN),
    @JsonProperty("tasks")
    TASKS(false, ArtifactKind.TASKS),
    @JsonProperty("analyze")
    ANALYZE(true),
    @JsonProperty("implement")
    IMPLEMENT(false),
    @JsonProperty("done")
    DONE(false);

    private final boolean optional;
    private final List<ArtifactKind> outputs;

    Phase(boolean optional, ArtifactKind... outputs) {
        this.optional = optional;
        this.outputs = List.of(outputs);
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isTerminal() {
        return this == DONE;
    }

    /** Artifact kinds this phase is expected to leave on disk. */
    public List<ArtifactKind> outputs() {
        return outputs;
    }

    /** Artifact kinds that must exist before this phase may start. */
    public Set<ArtifactKind> requiredInputs() {
        Set<ArtifactKind> inputs = EnumSet.noneOf(ArtifactKind.class);
        for (Phase earlier : values()) {
            if (earlier.ordinal() >= ordinal()) {
                break;
            }
            inputs.addAll(earlier.outputs);
        }
        return inputs;
    }

    public Optional<Phase> next() {
        return isTerminal() ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
    }

    /** Wire name, e.g. {@code "specify"}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Phase fromId(String id) {
        return Arrays.stream(values())
                .filter(p -> p.id().equalsIgnoreCase(id.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + id));
    }
}

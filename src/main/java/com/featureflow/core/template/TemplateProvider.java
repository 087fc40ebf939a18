package com.featureflow.core.template;

import com.featureflow.core.model.ArtifactKind;

import java.nio.file.Path;

/**
 * Seeds artifact files before a phase works on them.
 */
public interface TemplateProvider {

    /**
     * Creates {@code destination} for {@code kind}. Must not overwrite an existing file.
     */
    void createFromTemplate(ArtifactKind kind, Path destination);

    /**
     * Whether {@code path} still holds exactly what {@link #createFromTemplate} put there.
     * Providers that cannot tell return {@code false}.
     */
    default boolean isUnedited(ArtifactKind kind, Path path) {
        return false;
    }
}

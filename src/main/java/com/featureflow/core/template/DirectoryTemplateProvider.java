package com.featureflow.core.template;

import com.featureflow.core.model.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Copies {@code <templates-dir>/<name>-template.md} into place, or creates an empty
 * file when no template exists. The templates directory is looked up relative to
 * each ancestor of the destination, nearest first, so it is found under whichever
 * repository root the feature lives in.
 */
public class DirectoryTemplateProvider implements TemplateProvider {

    private static final Logger log = LoggerFactory.getLogger(DirectoryTemplateProvider.class);

    private final String templatesDir;

    public DirectoryTemplateProvider(String templatesDir) {
        this.templatesDir = templatesDir;
    }

    @Override
    public void createFromTemplate(ArtifactKind kind, Path destination) {
        try {
            if (kind.isDirectory()) {
                Files.createDirectories(destination);
                return;
            }
            if (Files.exists(destination)) {
                log.debug("{} already exists; leaving it untouched", destination);
                return;
            }
            Files.createDirectories(destination.getParent());
            Optional<Path> template = templateFor(kind, destination);
            if (template.isPresent()) {
                Files.copy(template.get(), destination);
                log.info("Created {} from template {}", destination, template.get());
            } else {
                Files.createFile(destination);
                log.info("Created empty {} (no {} found)", destination, kind.templateName());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + kind.docName() + " at " + destination, e);
        }
    }

    @Override
    public boolean isUnedited(ArtifactKind kind, Path path) {
        if (kind.isDirectory() || !Files.isRegularFile(path)) {
            return false;
        }
        try {
            if (Files.size(path) == 0) {
                return true;
            }
            Optional<Path> template = templateFor(kind, path);
            return template.isPresent()
                    && Arrays.equals(Files.readAllBytes(template.get()), Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compare " + path + " with its template", e);
        }
    }

    Optional<Path> templateFor(ArtifactKind kind, Path destination) {
        Path start = destination.toAbsolutePath().normalize().getParent();
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(templatesDir).resolve(kind.templateName());
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}

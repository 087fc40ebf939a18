package com.featureflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * The artifacts a feature directory may hold. {@link #CONTRACTS} is the only
 * directory-valued kind; it counts as present only when it has at least one entry.
 */
public enum ArtifactKind {
    @JsonProperty("spec")
    SPEC("spec", "spec.md", false),
    @JsonProperty("plan")
    PLAN("plan", "plan.md", false),
    @JsonProperty("research")
    RESEARCH("research", "research.md", false),
    @JsonProperty("dataModel")
    DATA_MODEL("dataModel", "data-model.md", false),
    @JsonProperty("contracts")
    CONTRACTS("contracts", "contracts", true),
    @JsonProperty("quickstart")
    QUICKSTART("quickstart", "quickstart.md", false),
    @JsonProperty("tasks")
    TASKS("tasks", "tasks.md", false);

    private final String id;
    private final String fileName;
    private final boolean directory;

    ArtifactKind(String id, String fileName, boolean directory) {
        this.id = id;
        this.fileName = fileName;
        this.directory = directory;
    }

    public String id() {
        return id;
    }

    public String fileName() {
        return fileName;
    }

    public boolean isDirectory() {
        return directory;
    }

    /** Name listed among available docs: the file name, with a trailing slash for directories. */
    public String docName() {
        return directory ? fileName + "/" : fileName;
    }

    /** Template file consulted by the default template provider, e.g. {@code plan-template.md}. */
    public String templateName() {
        return fileName.replace(".md", "") + "-template.md";
    }

    public static ArtifactKind fromId(String id) {
        String key = id.trim();
        return Arrays.stream(values())
                .filter(k -> k.id.equalsIgnoreCase(key) || k.name().equalsIgnoreCase(key)
                        || k.fileName.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown artifact kind: " + id));
    }
}

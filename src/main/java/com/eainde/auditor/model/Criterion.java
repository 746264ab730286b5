package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One rubric dimension as loaded from {@code rubric.json}.
 *
 * @param id                  stable criterion id, e.g. {@code git_forensic_analysis}
 * @param name                human-readable name
 * @param category            weight-table category; {@code default} when the rubric omits it
 * @param targetArtifact      which evidence source matters most ({@code repo}, {@code doc}, ...)
 * @param forensicInstruction what the reviewers should look for
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Criterion(
        @JsonProperty("id")                   String id,
        @JsonProperty("name")                 String name,
        @JsonProperty("category")             String category,
        @JsonProperty("target_artifact")      String targetArtifact,
        @JsonProperty("forensic_instruction") String forensicInstruction
) {

    public static final String DEFAULT_CATEGORY = "default";

    public Criterion {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Criterion id is required");
        }
        name = Objects.requireNonNullElse(name, id);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        targetArtifact = Objects.requireNonNullElse(targetArtifact, "all");
        forensicInstruction = Objects.requireNonNullElse(forensicInstruction, "");
    }

    public static Criterion of(String id, String category) {
        return new Criterion(id, id, category, null, null);
    }
}

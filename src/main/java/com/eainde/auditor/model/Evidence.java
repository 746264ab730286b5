package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The atomic output of a collector. Collectors never score, they only report what they found
 * and where.
 *
 * @param goal        what the collector was trying to establish
 * @param found       whether the artifact was located
 * @param location    file path, line or commit reference; must be citable
 * @param confidence  0.0 = unverifiable, 1.0 = irrefutable
 * @param rationale   what was examined and why the confidence is what it is
 * @param content     optional excerpt confirming the finding
 * @param criterionId rubric criterion this finding bears on, or null when general
 * @param severity    severity of the finding, {@link Severity#NONE} unless flagged
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Evidence(
        @JsonProperty("goal")        String goal,
        @JsonProperty("found")       boolean found,
        @JsonProperty("location")    String location,
        @JsonProperty("confidence")  double confidence,
        @JsonProperty("rationale")   String rationale,
        @JsonProperty("content")     String content,
        @JsonProperty("criterionId") String criterionId,
        @JsonProperty("severity")    Severity severity
) {

    public Evidence {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Evidence goal is required");
        }
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Evidence location is required for goal: " + goal);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Evidence confidence must be within [0,1], got " + confidence);
        }
        rationale = Objects.requireNonNullElse(rationale, "");
        severity = Objects.requireNonNullElse(severity, Severity.NONE);
    }

    public static Evidence of(String goal, boolean found, String location, double confidence, String rationale) {
        return new Evidence(goal, found, location, confidence, rationale, null, null, Severity.NONE);
    }

    public Evidence withContent(String newContent) {
        return new Evidence(goal, found, location, confidence, rationale, newContent, criterionId, severity);
    }

    public Evidence forCriterion(String newCriterionId) {
        return new Evidence(goal, found, location, confidence, rationale, content, newCriterionId, severity);
    }

    public Evidence withSeverity(Severity newSeverity) {
        return new Evidence(goal, found, location, confidence, rationale, content, criterionId, newSeverity);
    }

    public boolean concerns(String criterion) {
        return criterionId != null && criterionId.equals(criterion);
    }
}

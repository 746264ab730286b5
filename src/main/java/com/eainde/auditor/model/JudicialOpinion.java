package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One reviewer role's score for one rubric criterion.
 *
 * @param criterionId   rubric criterion id
 * @param role          the reviewer that produced the opinion
 * @param score         score on the rubric scale
 * @param rationale     argument citing evidence locations
 * @param citedEvidence evidence locations backing the argument
 * @param degraded      true when the generator never produced a valid payload and this is a placeholder
 */
public record JudicialOpinion(
        @JsonProperty("criterionId")   String criterionId,
        @JsonProperty("role")          ReviewerRole role,
        @JsonProperty("score")         int score,
        @JsonProperty("rationale")     String rationale,
        @JsonProperty("citedEvidence") List<String> citedEvidence,
        @JsonProperty("degraded")      boolean degraded
) {

    /** Deterministic order for anything externally visible: criterion, then role. */
    public static final Comparator<JudicialOpinion> CANONICAL_ORDER = Comparator
            .comparing(JudicialOpinion::criterionId)
            .thenComparing(JudicialOpinion::role)
            .thenComparingInt(JudicialOpinion::score)
            .thenComparing(JudicialOpinion::degraded)
            .thenComparing(JudicialOpinion::rationale)
            .thenComparing(opinion -> String.join("\u0000", opinion.citedEvidence()));

    public JudicialOpinion {
        Objects.requireNonNull(criterionId, "criterionId");
        Objects.requireNonNull(role, "role");
        rationale = Objects.requireNonNullElse(rationale, "");
        citedEvidence = citedEvidence == null ? List.of() : List.copyOf(citedEvidence);
    }
}

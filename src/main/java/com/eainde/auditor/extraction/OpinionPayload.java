package com.eainde.auditor.extraction;

import com.eainde.auditor.model.JudicialOpinion;
import com.eainde.auditor.model.ReviewerRole;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The JSON object a reviewer is asked to return for one criterion.
 *
 * @param score         integer score on the rubric scale
 * @param argument      the reviewer's argument; {@code rationale} is accepted as an alias
 * @param citedEvidence evidence locations the argument relies on
 */
public record OpinionPayload(
        @JsonProperty("score")                                int score,
        @JsonProperty("argument") @JsonAlias("rationale")     String argument,
        @JsonProperty("cited_evidence") @JsonAlias("citedEvidence") List<String> citedEvidence
) {

    public OpinionPayload {
        citedEvidence = citedEvidence == null ? List.of() : List.copyOf(citedEvidence);
    }

    public JudicialOpinion toOpinion(String criterionId, ReviewerRole role, boolean degraded) {
        return new JudicialOpinion(criterionId, role, score, argument, citedEvidence, degraded);
    }
}

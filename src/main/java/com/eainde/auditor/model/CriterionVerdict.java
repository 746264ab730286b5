package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * The synthesized ruling for one criterion. Either {@code finalScore} is set, or the verdict is
 * unscored and {@code unscoredReason} says why; a guessed score is never produced.
 *
 * @param criterionId         rubric criterion id
 * @param criterionName       rubric criterion name
 * @param finalScore          final score, null when unscored
 * @param unscoredReason      why no score could be produced, null when scored
 * @param opinions            every opinion considered for this criterion, in canonical order
 * @param dissent             explanation attached when reviewers disagreed beyond the threshold
 * @param factOverrideApplied whether a confirmed high-severity finding capped the scores
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CriterionVerdict(
        @JsonProperty("criterionId")         String criterionId,
        @JsonProperty("criterionName")       String criterionName,
        @JsonProperty("finalScore")          Integer finalScore,
        @JsonProperty("unscoredReason")      String unscoredReason,
        @JsonProperty("opinions")            List<JudicialOpinion> opinions,
        @JsonProperty("dissent")             String dissent,
        @JsonProperty("factOverrideApplied") boolean factOverrideApplied
) {

    public CriterionVerdict {
        opinions = opinions == null ? List.of() : List.copyOf(opinions);
        if ((finalScore == null) == (unscoredReason == null)) {
            throw new IllegalArgumentException(
                    "Verdict for " + criterionId + " must carry exactly one of finalScore or unscoredReason");
        }
    }

    public static CriterionVerdict scored(Criterion criterion, int score, List<JudicialOpinion> opinions,
                                          String dissent, boolean factOverrideApplied) {
        return new CriterionVerdict(criterion.id(), criterion.name(), score, null, opinions, dissent,
                factOverrideApplied);
    }

    public static CriterionVerdict unscored(Criterion criterion, String reason, List<JudicialOpinion> opinions) {
        return new CriterionVerdict(criterion.id(), criterion.name(), null, reason, opinions, null, false);
    }

    @JsonIgnore
    public boolean isScored() {
        return finalScore != null;
    }

    @JsonIgnore
    public Optional<String> dissentExplanation() {
        return Optional.ofNullable(dissent);
    }
}

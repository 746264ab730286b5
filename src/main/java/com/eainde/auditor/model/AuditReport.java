package com.eainde.auditor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * The final result of one audit run: all verdicts plus the mean over the scored ones.
 *
 * @param verdicts     one verdict per rubric criterion, sorted by criterion id
 * @param overallScore mean of the scored verdicts (HALF_UP, two decimals); null when nothing was scored
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditReport(
        @JsonProperty("verdicts")     List<CriterionVerdict> verdicts,
        @JsonProperty("overallScore") BigDecimal overallScore
) {

    public AuditReport {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    public static AuditReport of(List<CriterionVerdict> verdicts) {
        List<Integer> scores = verdicts.stream()
                .filter(CriterionVerdict::isScored)
                .map(CriterionVerdict::finalScore)
                .toList();
        if (scores.isEmpty()) {
            return new AuditReport(verdicts, null);
        }
        BigDecimal total = scores.stream().map(BigDecimal::valueOf).reduce(BigDecimal.ZERO, BigDecimal::add);
        return new AuditReport(verdicts, total.divide(BigDecimal.valueOf(scores.size()), 2, RoundingMode.HALF_UP));
    }

    public Optional<CriterionVerdict> verdictFor(String criterionId) {
        return verdicts.stream().filter(v -> v.criterionId().equals(criterionId)).findFirst();
    }
}

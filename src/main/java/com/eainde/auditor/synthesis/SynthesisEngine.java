package com.eainde.auditor.synthesis;

import com.eainde.auditor.model.AuditReport;
import com.eainde.auditor.model.Criterion;
import com.eainde.auditor.model.CriterionVerdict;
import com.eainde.auditor.model.Evidence;
import com.eainde.auditor.model.JudicialOpinion;
import com.eainde.auditor.model.ReviewerRole;
import com.eainde.auditor.model.Severity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reduces the reviewers' opinions to one verdict per criterion with fixed rules, applied in order:
 *
 * <ol>
 *     <li><b>Fact override</b>: a confirmed high-severity finding for the criterion caps every
 *     score at the configured ceiling before aggregation.</li>
 *     <li><b>Role weighting</b>: weighted mean over the criterion category's role weights, rounded
 *     half-up to the nearest score on the scale.</li>
 *     <li><b>Missing opinions</b>: degraded or absent roles are left out and their weight is
 *     shared proportionally by the rest. No usable role at all yields an unscored verdict.</li>
 *     <li><b>Dissent</b>: when the spread of the uncapped scores exceeds the threshold, the roles
 *     farthest from the final score are named.</li>
 * </ol>
 *
 * <p>Stateless and pure. Input order never changes the output; verdicts come back sorted by
 * criterion id and their opinions in (criterion, role) order.</p>
 */
public class SynthesisEngine {

    private static final int MEAN_SCALE = 10;

    private final SynthesisConfig config;

    public SynthesisEngine(SynthesisConfig config) {
        this.config = config;
    }

    public AuditReport report(List<Criterion> criteria, Map<String, List<Evidence>> evidence,
                              List<JudicialOpinion> opinions) {
        return AuditReport.of(synthesize(criteria, evidence, opinions));
    }

    public List<CriterionVerdict> synthesize(List<Criterion> criteria, Map<String, List<Evidence>> evidence,
                                             List<JudicialOpinion> opinions) {
        List<Evidence> allEvidence = evidence.values().stream().flatMap(Collection::stream).toList();
        Map<String, List<JudicialOpinion>> byCriterion = opinions.stream()
                .collect(Collectors.groupingBy(JudicialOpinion::criterionId));

        return criteria.stream()
                .sorted(Comparator.comparing(Criterion::id))
                .map(criterion -> verdictFor(criterion, allEvidence,
                        byCriterion.getOrDefault(criterion.id(), List.of())))
                .toList();
    }

    CriterionVerdict verdictFor(Criterion criterion, List<Evidence> evidence, List<JudicialOpinion> opinions) {
        List<JudicialOpinion> considered = opinions.stream().sorted(JudicialOpinion.CANONICAL_ORDER).toList();

        Map<ReviewerRole, BigDecimal> roleScores = roleScores(considered);
        if (roleScores.isEmpty()) {
            return CriterionVerdict.unscored(criterion, noUsableOpinionReason(considered), considered);
        }

        BigDecimal totalWeight = BigDecimal.ZERO;
        BigDecimal weightedSum = BigDecimal.ZERO;
        Optional<Evidence> confirmedFinding = confirmedHighSeverityFinding(criterion, evidence);
        BigDecimal ceiling = BigDecimal.valueOf(config.factOverrideCeiling());
        for (Map.Entry<ReviewerRole, BigDecimal> entry : roleScores.entrySet()) {
            BigDecimal weight = config.weights().weight(criterion.category(), entry.getKey());
            BigDecimal effective = confirmedFinding.isPresent() ? entry.getValue().min(ceiling) : entry.getValue();
            totalWeight = totalWeight.add(weight);
            weightedSum = weightedSum.add(weight.multiply(effective));
        }
        if (totalWeight.signum() == 0) {
            return CriterionVerdict.unscored(criterion,
                    "the reviewing roles " + names(roleScores.keySet()) + " carry no weight in category '"
                            + criterion.category() + "'",
                    considered);
        }

        BigDecimal mean = weightedSum.divide(totalWeight, MEAN_SCALE, RoundingMode.HALF_UP);
        int finalScore = config.scale().clamp(mean.setScale(0, RoundingMode.HALF_UP).intValueExact());
        String dissent = dissent(roleScores, finalScore, confirmedFinding).orElse(null);
        return CriterionVerdict.scored(criterion, finalScore, considered, dissent, confirmedFinding.isPresent());
    }

    /** Mean score per role over its usable opinions, in role declaration order. */
    private Map<ReviewerRole, BigDecimal> roleScores(List<JudicialOpinion> considered) {
        Map<ReviewerRole, List<Integer>> usable = new EnumMap<>(ReviewerRole.class);
        for (JudicialOpinion opinion : considered) {
            if (!opinion.degraded() && config.scale().contains(opinion.score())) {
                usable.computeIfAbsent(opinion.role(), role -> new ArrayList<>()).add(opinion.score());
            }
        }
        Map<ReviewerRole, BigDecimal> scores = new EnumMap<>(ReviewerRole.class);
        usable.forEach((role, values) -> {
            BigDecimal sum = values.stream().map(BigDecimal::valueOf).reduce(BigDecimal.ZERO, BigDecimal::add);
            scores.put(role, sum.divide(BigDecimal.valueOf(values.size()), MEAN_SCALE, RoundingMode.HALF_UP));
        });
        return scores;
    }

    private Optional<Evidence> confirmedHighSeverityFinding(Criterion criterion, List<Evidence> evidence) {
        return evidence.stream()
                .filter(item -> item.concerns(criterion.id()))
                .filter(Evidence::found)
                .filter(item -> item.severity() == Severity.HIGH)
                .filter(item -> item.confidence() >= config.confirmationConfidence())
                .min(Comparator.comparing(Evidence::location).thenComparing(Evidence::goal));
    }

    private Optional<String> dissent(Map<ReviewerRole, BigDecimal> roleScores, int finalScore,
                                     Optional<Evidence> confirmedFinding) {
        BigDecimal max = roleScores.values().stream().max(Comparator.naturalOrder()).orElseThrow();
        BigDecimal min = roleScores.values().stream().min(Comparator.naturalOrder()).orElseThrow();
        BigDecimal spread = max.subtract(min);
        if (spread.compareTo(BigDecimal.valueOf(config.dissentThreshold())) <= 0) {
            return Optional.empty();
        }

        BigDecimal target = BigDecimal.valueOf(finalScore);
        BigDecimal farthest = roleScores.values().stream()
                .map(score -> score.subtract(target).abs())
                .max(Comparator.naturalOrder())
                .orElseThrow();
        List<ReviewerRole> outliers = roleScores.entrySet().stream()
                .filter(entry -> entry.getValue().subtract(target).abs().compareTo(farthest) == 0)
                .map(Map.Entry::getKey)
                .toList();

        StringBuilder text = new StringBuilder()
                .append("Score spread ").append(plain(spread))
                .append(" exceeds threshold ").append(config.dissentThreshold())
                .append(" (").append(roleScores.entrySet().stream()
                        .map(entry -> entry.getKey().displayName() + " " + plain(entry.getValue()))
                        .collect(Collectors.joining(", ")))
                .append("); final score ").append(finalScore)
                .append(" overrules ").append(names(outliers));
        confirmedFinding.ifPresent(finding -> text
                .append("; fact override capped all scores at ").append(config.factOverrideCeiling())
                .append(" after a confirmed high-severity finding at ").append(finding.location()));
        return Optional.of(text.toString());
    }

    private static String noUsableOpinionReason(List<JudicialOpinion> considered) {
        if (considered.isEmpty()) {
            return "no reviewer produced an opinion for this criterion";
        }
        long degraded = considered.stream().filter(JudicialOpinion::degraded).count();
        if (degraded == considered.size()) {
            return "all " + degraded + " opinion(s) were degraded placeholders";
        }
        return "no opinion carried a usable score (" + degraded + " degraded, "
                + (considered.size() - degraded) + " out of scale)";
    }

    private static String names(Collection<ReviewerRole> roles) {
        return roles.stream().map(ReviewerRole::displayName).collect(Collectors.joining(", "));
    }

    private static String plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }
}

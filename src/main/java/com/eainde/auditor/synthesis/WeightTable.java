package com.eainde.auditor.synthesis;

import com.eainde.auditor.model.ReviewerRole;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed role weights per criterion category. A category without a row weighs every role
 * equally; inside a row, a role that is not listed weighs zero.
 */
public final class WeightTable {

    private static final Map<ReviewerRole, BigDecimal> EQUAL = equalWeightRow();

    private final Map<String, Map<ReviewerRole, BigDecimal>> rows;

    private WeightTable(Map<String, Map<ReviewerRole, BigDecimal>> rows) {
        this.rows = rows;
    }

    public static WeightTable equalWeights() {
        return new WeightTable(Map.of());
    }

    public static WeightTable of(Map<String, Map<ReviewerRole, Double>> rows) {
        Map<String, Map<ReviewerRole, BigDecimal>> copy = new TreeMap<>();
        rows.forEach((category, weights) -> {
            Map<ReviewerRole, BigDecimal> row = new EnumMap<>(ReviewerRole.class);
            weights.forEach((role, weight) -> {
                if (weight == null || weight.isNaN() || weight < 0) {
                    throw new IllegalArgumentException(
                            "Weight for " + role + " in category '" + category + "' must be >= 0, got " + weight);
                }
                row.put(role, BigDecimal.valueOf(weight));
            });
            if (row.values().stream().allMatch(w -> w.signum() == 0)) {
                throw new IllegalArgumentException("Category '" + category + "' gives every role zero weight");
            }
            copy.put(category, Collections.unmodifiableMap(row));
        });
        return new WeightTable(Collections.unmodifiableMap(copy));
    }

    /** Weight of {@code role} for criteria in {@code category}. */
    public BigDecimal weight(String category, ReviewerRole role) {
        return rows.getOrDefault(category, EQUAL).getOrDefault(role, BigDecimal.ZERO);
    }

    public boolean hasRow(String category) {
        return rows.containsKey(category);
    }

    private static Map<ReviewerRole, BigDecimal> equalWeightRow() {
        Map<ReviewerRole, BigDecimal> weights = new EnumMap<>(ReviewerRole.class);
        for (ReviewerRole role : ReviewerRole.values()) {
            weights.put(role, BigDecimal.ONE);
        }
        return Collections.unmodifiableMap(weights);
    }
}

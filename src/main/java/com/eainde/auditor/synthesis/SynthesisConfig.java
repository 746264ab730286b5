package com.eainde.auditor.synthesis;

import com.eainde.auditor.model.ScoreScale;

/**
 * Immutable arbitration rules.
 *
 * @param scale                  valid score domain
 * @param factOverrideCeiling    cap applied to every score when a confirmed high-severity finding exists
 * @param dissentThreshold       spread above which a dissent explanation is attached
 * @param confirmationConfidence minimum evidence confidence for a finding to count as confirmed
 * @param weights                role weights per criterion category
 */
public record SynthesisConfig(ScoreScale scale, int factOverrideCeiling, int dissentThreshold,
                              double confirmationConfidence, WeightTable weights) {

    public static final SynthesisConfig DEFAULT =
            new SynthesisConfig(ScoreScale.DEFAULT, 3, 2, 0.8, WeightTable.equalWeights());

    public SynthesisConfig {
        if (!scale.contains(factOverrideCeiling)) {
            throw new IllegalArgumentException("factOverrideCeiling " + factOverrideCeiling + " is outside the score scale");
        }
        if (dissentThreshold < 0) {
            throw new IllegalArgumentException("dissentThreshold must not be negative");
        }
        if (confirmationConfidence < 0.0 || confirmationConfidence > 1.0) {
            throw new IllegalArgumentException("confirmationConfidence must be within [0,1]");
        }
    }

    public SynthesisConfig withWeights(WeightTable table) {
        return new SynthesisConfig(scale, factOverrideCeiling, dissentThreshold, confirmationConfidence, table);
    }
}

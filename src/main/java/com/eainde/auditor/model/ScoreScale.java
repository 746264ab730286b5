package com.eainde.auditor.model;

/**
 * The discrete score domain shared by reviewers and verdicts, inclusive on both ends.
 */
public record ScoreScale(int min, int max) {

    public static final ScoreScale DEFAULT = new ScoreScale(1, 5);

    public ScoreScale {
        if (min > max) {
            throw new IllegalArgumentException("Score scale min " + min + " exceeds max " + max);
        }
    }

    public boolean contains(int score) {
        return score >= min && score <= max;
    }

    public int clamp(int score) {
        return Math.max(min, Math.min(max, score));
    }

    /** Integer midpoint, rounded up. Used for placeholder opinions. */
    public int midpoint() {
        return (min + max + 1) / 2;
    }
}

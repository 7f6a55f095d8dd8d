package com.congruence.core.model;

/**
 * Coarse banding of a congruence score.
 */
public enum ScoreBand {
    EXCELLENT,
    GOOD,
    MODERATE,
    POOR;

    public static ScoreBand of(double score) {
        if (score >= 0.8) return EXCELLENT;
        if (score >= 0.6) return GOOD;
        if (score >= 0.4) return MODERATE;
        return POOR;
    }
}

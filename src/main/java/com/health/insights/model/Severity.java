package com.health.insights.model;

/**
 * Discrete anomaly tier shared by every detector so severities stay comparable
 * across detector types. Each tier's lower bound is inclusive.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    public static final double HIGH_THRESHOLD = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.5;

    public static Severity fromScore(double score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}

package com.health.insights.model;

public enum CorrelationStrength {
    STRONG_POSITIVE,
    MODERATE_POSITIVE,
    WEAK_POSITIVE,
    NEGLIGIBLE,
    WEAK_NEGATIVE,
    MODERATE_NEGATIVE,
    STRONG_NEGATIVE;

    /** Label for a signed coefficient in [-1, 1]. */
    public static CorrelationStrength fromValue(double value) {
        if (value >= 0.7) return STRONG_POSITIVE;
        if (value >= 0.4) return MODERATE_POSITIVE;
        if (value >= 0.2) return WEAK_POSITIVE;
        if (value >= -0.2) return NEGLIGIBLE;
        if (value >= -0.4) return WEAK_NEGATIVE;
        if (value >= -0.7) return MODERATE_NEGATIVE;
        return STRONG_NEGATIVE;
    }

    /** Label for an unsigned dependence measure in [0, 1] (information coefficient, explained variance). */
    public static CorrelationStrength fromUnsigned(double value) {
        if (value >= 0.7) return STRONG_POSITIVE;
        if (value >= 0.4) return MODERATE_POSITIVE;
        if (value >= 0.2) return WEAK_POSITIVE;
        return NEGLIGIBLE;
    }
}

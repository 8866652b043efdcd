package com.health.insights.model;

public enum CorrelationType {
    PEARSON(CorrelationFamily.LINEAR, true),
    SPEARMAN(CorrelationFamily.LINEAR, true),
    CROSS_CORRELATION(CorrelationFamily.LAGGED, true),
    GRANGER(CorrelationFamily.CAUSAL, false),
    MUTUAL_INFORMATION(CorrelationFamily.INFORMATION, false);

    private final CorrelationFamily family;
    private final boolean signed;

    CorrelationType(CorrelationFamily family, boolean signed) {
        this.family = family;
        this.signed = signed;
    }

    public CorrelationFamily getFamily() {
        return family;
    }

    /** Whether the strength of this type carries the direction of association. */
    public boolean isSigned() {
        return signed;
    }
}

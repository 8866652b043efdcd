package com.health.insights.model;

/**
 * How a personal baseline is estimated from a metric's history.
 */
public enum BaselineStrategy {
    /** Median and IQR scaled to a standard-deviation equivalent. */
    ROBUST,
    /** Robust baseline whose spread widens for noisy metrics and narrows for stable ones. */
    ADAPTIVE,
    /** Exponentially weighted center and spread that follow slow trends. */
    EWMA;

    /**
     * Resolves the request flags into a single strategy.
     * Precedence: EWMA over ADAPTIVE over ROBUST. With no flag set, ROBUST is used.
     */
    public static BaselineStrategy resolve(boolean useRobust, boolean useAdaptive, boolean useEwma) {
        if (useEwma) return EWMA;
        if (useAdaptive) return ADAPTIVE;
        return ROBUST;
    }
}

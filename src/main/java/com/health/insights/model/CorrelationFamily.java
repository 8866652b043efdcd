package com.health.insights.model;

/**
 * Independent detector families. Agreement on a merged correlation counts
 * families, not individual results, so Pearson and Spearman together count once.
 */
public enum CorrelationFamily {
    LINEAR,
    LAGGED,
    CAUSAL,
    INFORMATION
}

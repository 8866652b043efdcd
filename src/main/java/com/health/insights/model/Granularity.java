package com.health.insights.model;

/**
 * Time resolution a correlation was measured at.
 */
public enum Granularity {
    DAILY,
    /** Monday-start weekly means. */
    WEEKLY
}

package com.health.insights.model;

/**
 * Lifecycle of one detection run: PENDING -> RUNNING -> {COMPLETED, PARTIAL, FAILED, CANCELLED}.
 * PARTIAL means at least one detector failed while others completed.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}

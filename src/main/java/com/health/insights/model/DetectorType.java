package com.health.insights.model;

public enum DetectorType {
    ZSCORE,
    ISOLATION_FOREST,
    ENSEMBLE
}

package com.health.insights.model;

public enum CausalDirection {
    A_CAUSES_B,
    B_CAUSES_A,
    BIDIRECTIONAL,
    NONE
}

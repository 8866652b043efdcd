package com.health.insights.service;

import com.health.insights.model.AnomalyResult;

import java.util.List;

/**
 * Published after a run that asked for explanations. Whoever generates the text listens for it.
 */
public record AnomalyExplanationRequestedEvent(String userId, String runId, List<AnomalyResult> anomalies) {}

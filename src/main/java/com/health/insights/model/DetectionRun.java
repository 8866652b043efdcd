package com.health.insights.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one orchestrated detection pass over a user's snapshot.
 * Anomalies and correlations are in deterministic order so two runs over the
 * same data compare equal on content.
 */
@Value
@Builder
public class DetectionRun {

    String runId;
    String userId;
    LocalDate from;
    LocalDate to;
    BaselineStrategy baselineStrategy;
    RunStatus status;
    List<AnomalyResult> anomalies;
    List<CorrelationResult> correlationResults;
    List<MergedCorrelation> correlations;
    List<DetectorFailure> failures;
    List<String> skipped;
    String error;
    Instant startedAt;
    Instant completedAt;

    public static DetectionRun failed(String runId, String userId, LocalDate from, LocalDate to,
                                      String error, Instant startedAt) {
        return DetectionRun.builder()
                .runId(runId)
                .userId(userId)
                .from(from)
                .to(to)
                .status(RunStatus.FAILED)
                .anomalies(List.of())
                .correlationResults(List.of())
                .correlations(List.of())
                .failures(List.of())
                .skipped(List.of())
                .error(error)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }
}

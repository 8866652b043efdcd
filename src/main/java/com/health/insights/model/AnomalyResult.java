package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Map;

/**
 * A single day/metric value flagged by one detector. Immutable once built.
 *
 * Detail keys read by the explanation collaborator:
 * {@code z_score}, {@code threshold}, {@code spread}, {@code bounds_violation},
 * {@code baseline_strategy}, {@code mean_path_length}, {@code isolation_score},
 * {@code detection_agreement}.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Point anomaly: a day/metric value that deviates from the user's personal baseline")
public class AnomalyResult {

    @Schema(description = "Date of the anomalous observation", example = "2025-03-14")
    LocalDate occurredOn;

    @Schema(description = "Table of the originating raw record", example = "sleep_entries")
    String sourceTable;

    @Schema(description = "Identifier of the originating raw record (carried, never dereferenced)")
    String sourceId;

    @Schema(description = "Metric key", example = "sleep_hours")
    String metricName;

    @Schema(description = "Observed value", example = "3.1")
    double metricValue;

    @Schema(description = "Baseline center at that date", example = "7.2")
    double baselineValue;

    @Schema(description = "Detector that produced this result", example = "ZSCORE")
    DetectorType detectorType;

    @Schema(description = "Tier derived from the anomaly score: HIGH >= 0.8, MEDIUM >= 0.5, otherwise LOW", example = "HIGH")
    Severity severity;

    @Schema(description = "Continuous anomaly score in [0, 1]; higher is more anomalous", example = "0.86")
    double anomalyScore;

    @Schema(description = "Detector-specific diagnostics")
    Map<String, Object> details;

    AnomalyResult(LocalDate occurredOn, String sourceTable, String sourceId, String metricName,
                  double metricValue, double baselineValue, DetectorType detectorType,
                  Severity severity, double anomalyScore, Map<String, Object> details) {
        this.occurredOn = occurredOn;
        this.sourceTable = sourceTable;
        this.sourceId = sourceId;
        this.metricName = metricName;
        this.metricValue = metricValue;
        this.baselineValue = baselineValue;
        this.detectorType = detectorType;
        this.severity = severity;
        this.anomalyScore = anomalyScore;
        this.details = ResultDetails.copyOf(details);
    }

    /** Builds a result whose severity is derived from the score. */
    public static AnomalyResultBuilder scored(double anomalyScore) {
        return AnomalyResult.builder()
                .anomalyScore(anomalyScore)
                .severity(Severity.fromScore(anomalyScore));
    }
}

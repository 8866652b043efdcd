package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters of a detection run over a trailing window of a user's daily metrics")
public class DetectionRequest {

    @Schema(description = "Window length in days, ending at endDate. Defaults to detection.default-window-days.",
            example = "60")
    private Integer days;

    @Schema(description = "Last day of the window (inclusive). Defaults to today.", example = "2025-03-31")
    private LocalDate endDate;

    @Schema(description = "Use the robust (median/IQR) baseline", example = "true")
    @Builder.Default
    private boolean useRobust = true;

    @Schema(description = "Scale the robust spread by the metric's variability", example = "true")
    @Builder.Default
    private boolean useAdaptive = true;

    @Schema(description = "Use an exponentially weighted baseline; takes precedence over the other flags", example = "false")
    @Builder.Default
    private boolean useEwmaBaseline = false;

    @Schema(description = "Ask the explanation collaborator to describe the anomalies found", example = "false")
    @Builder.Default
    private boolean includeExplanation = false;

    @Schema(description = "Also discover correlations between metric pairs", example = "true")
    @Builder.Default
    private boolean includeCorrelations = true;

    @Schema(description = "Correlation verdicts with a lower composite confidence are dropped", example = "0.3")
    @Builder.Default
    private double minConfidence = 0.3;

    @Schema(description = "Compare each correlation verdict with other users' verdicts for the same pair", example = "true")
    @Builder.Default
    private boolean includePopulationComparison = true;

    @Schema(description = "Anomaly detectors to run. Empty means all.", example = "[\"ZSCORE\", \"ISOLATION_FOREST\"]")
    private Set<DetectorType> anomalyDetectors;

    @Schema(description = "Correlation methods to run. Empty means all.", example = "[\"PEARSON\", \"GRANGER\"]")
    private Set<CorrelationType> correlationTypes;

    @Schema(description = "Restrict the run to these metrics. Empty means every metric with data.")
    private List<String> metrics;

    public BaselineStrategy baselineStrategy() {
        return BaselineStrategy.resolve(useRobust, useAdaptive, useEwmaBaseline);
    }

    public LocalDate resolveEndDate() {
        return endDate != null ? endDate : LocalDate.now();
    }

    public LocalDate resolveStartDate(int defaultDays) {
        int window = days != null ? days : defaultDays;
        return resolveEndDate().minusDays(Math.max(1, window) - 1L);
    }

    public boolean runs(DetectorType type) {
        return anomalyDetectors == null || anomalyDetectors.isEmpty() || anomalyDetectors.contains(type);
    }

    public boolean runs(CorrelationType type) {
        return correlationTypes == null || correlationTypes.isEmpty() || correlationTypes.contains(type);
    }
}

package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Counts of stored anomalies over a lookback period")
public class AnomalySummary {

    @Schema(description = "Lookback period in days", example = "30")
    int days;

    @Schema(description = "Total anomalies in the period", example = "7")
    int total;

    @Schema(description = "Anomalies per severity")
    Map<Severity, Integer> bySeverity;

    @Schema(description = "Anomalies per metric")
    Map<String, Integer> byMetric;
}

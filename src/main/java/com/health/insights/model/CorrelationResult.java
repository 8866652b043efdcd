package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Association between two metrics found by one correlation detector")
public class CorrelationResult {

    @Schema(description = "First metric; the cause for directional methods", example = "exercise_minutes")
    String metricA;

    @Schema(description = "Second metric; the effect for directional methods", example = "sleep_quality")
    String metricB;

    @Schema(description = "Method that produced the result", example = "PEARSON")
    CorrelationType correlationType;

    @Schema(description = "Normalized magnitude of association, signed for linear types", example = "0.62")
    double strength;

    @Schema(description = "Day offset at which the association is strongest (metric B trails metric A)", example = "0")
    int lagDays;

    @Schema(description = "p-value or explicit unsupported marker")
    StatisticalConfidence confidence;

    @Schema(description = "Number of paired observations used", example = "58")
    int sampleSize;

    @Schema(description = "Whether the method considers the association significant")
    boolean significant;

    @Schema(description = "Causal direction for Granger results", example = "A_CAUSES_B")
    CausalDirection causalDirection;

    @Schema(description = "Time resolution of the paired values", example = "DAILY")
    Granularity granularity;

    @Schema(description = "Method-specific diagnostics")
    Map<String, Object> details;

    CorrelationResult(String metricA, String metricB, CorrelationType correlationType, double strength,
                      int lagDays, StatisticalConfidence confidence, int sampleSize, boolean significant,
                      CausalDirection causalDirection, Granularity granularity, Map<String, Object> details) {
        this.metricA = metricA;
        this.metricB = metricB;
        this.correlationType = correlationType;
        this.strength = strength;
        this.lagDays = lagDays;
        this.confidence = confidence;
        this.sampleSize = sampleSize;
        this.significant = significant;
        this.causalDirection = causalDirection;
        this.granularity = granularity != null ? granularity : Granularity.DAILY;
        this.details = ResultDetails.copyOf(details);
    }

    /**
     * Scalar confidence in [0, 1] used for ranking: (1 - p) * |strength| for tested
     * linear methods, 1 - p capped at 0.99 for Granger, |strength| for untested methods.
     */
    public double confidenceScore() {
        double magnitude = Math.min(1.0, Math.abs(strength));
        if (!confidence.supported()) {
            return magnitude;
        }
        if (correlationType == CorrelationType.GRANGER) {
            return Math.min(0.99, 1.0 - confidence.pValue());
        }
        return (1.0 - confidence.pValue()) * magnitude;
    }
}

package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Confidence-weighted verdict for one metric pair, merged across all correlation detectors")
public class MergedCorrelation {

    @Schema(description = "First metric of the pair", example = "exercise_minutes")
    String metricA;

    @Schema(description = "Second metric of the pair", example = "sleep_quality")
    String metricB;

    @Schema(description = "Method whose result leads the verdict", example = "GRANGER")
    CorrelationType leadType;

    @Schema(description = "Strength reported by the lead result", example = "0.58")
    double strength;

    @Schema(description = "Strength label", example = "MODERATE_POSITIVE")
    CorrelationStrength strengthLabel;

    @Schema(description = "Lag of the lead result in days", example = "1")
    int lagDays;

    @Schema(description = "Causal direction established by Granger tests", example = "A_CAUSES_B")
    CausalDirection causalDirection;

    @Schema(description = "Confidence of the lead result")
    StatisticalConfidence confidence;

    @Schema(description = "Whether the lead result is significant")
    boolean significant;

    @Schema(description = "Weighted confidence across all surviving detector results", example = "0.71")
    double compositeConfidence;

    @Schema(description = "Number of independent detector families concurring on a significant association", example = "3")
    int agreement;

    @Schema(description = "Whether significant signed results disagree on the sign of the association")
    boolean signConflict;

    @Schema(description = "Whether the relationship is strong and corroborated enough to act upon")
    boolean actionable;

    @Schema(description = "Largest sample size among contributing results", example = "58")
    int sampleSize;

    @Schema(description = "Time resolution the contributing results were measured at", example = "DAILY")
    @Builder.Default
    Granularity granularity = Granularity.DAILY;

    @Schema(description = "Detector results the verdict was built from")
    List<CorrelationResult> contributions;

    @Schema(description = "Comparison with other users; absent when not requested")
    PopulationComparison population;
}

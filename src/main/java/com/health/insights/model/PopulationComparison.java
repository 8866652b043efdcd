package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "How a user's correlation compares with the same relationship across other users")
public class PopulationComparison {

    @Schema(description = "Population mean strength for the pair", example = "0.35")
    double mean;

    @Schema(description = "Population standard deviation of the strength", example = "0.15")
    double std;

    @Schema(description = "Number of other users the statistics come from; 0 for a default baseline", example = "0")
    int count;

    @Schema(description = "Whether the statistics are a published default rather than stored verdicts")
    boolean defaultBaseline;

    @Schema(description = "Percentile of the distance from the population mean (0-100)", example = "84.1")
    double percentileRank;

    @Schema(description = "Absolute distance from the population mean in standard deviations", example = "1.02")
    double distanceInStd;

    @Schema(description = "Whether the user's strength is unusually far from the population")
    boolean unusual;
}

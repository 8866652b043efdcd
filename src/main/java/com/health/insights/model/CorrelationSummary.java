package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Overview of a user's stored correlation verdicts")
public class CorrelationSummary {

    @Schema(description = "Number of verdicts", example = "12")
    int total;

    @Schema(description = "Verdicts whose lead result is significant", example = "8")
    int significant;

    @Schema(description = "Verdicts considered actionable", example = "3")
    int actionable;

    @Schema(description = "Verdicts per lead method")
    Map<CorrelationType, Integer> byType;

    @Schema(description = "Verdicts per strength label")
    Map<CorrelationStrength, Integer> byStrength;

    @Schema(description = "Verdicts per time resolution")
    Map<Granularity, Integer> byGranularity;

    @Schema(description = "One-line descriptions of the strongest findings",
            example = "[\"exercise_minutes -> sleep_quality (MODERATE_POSITIVE, lag 1d)\"]")
    List<String> topFindings;
}

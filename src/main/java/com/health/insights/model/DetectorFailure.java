package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "A detector that raised during computation; recorded instead of aborting the run")
public class DetectorFailure {

    @Schema(description = "Detector name", example = "ISOLATION_FOREST")
    String detector;

    @Schema(description = "Metric or metric pair the detector was working on", example = "resting_hr")
    String scope;

    @Schema(description = "Exception class", example = "java.lang.IllegalStateException")
    String errorType;

    @Schema(description = "Exception message")
    String message;
}

package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Result of a detection run as returned to callers")
public class DetectionResult {

    @Schema(description = "Identifier of the result batch", example = "b3a4c1de-0f0e-4b6e-9a0d-2c8f5e7d1a90")
    String runId;

    @Schema(description = "User the run was executed for", example = "user-42")
    String userId;

    @Schema(description = "Final run status", example = "COMPLETED")
    RunStatus status;

    @Schema(description = "Number of anomalies found in this run", example = "4")
    int totalAnomalies;

    @Schema(description = "Number of anomalies not stored by an earlier run", example = "1")
    int newAnomalies;

    @Schema(description = "Anomalies found, most severe first")
    List<AnomalyResult> anomalies;

    @Schema(description = "Merged correlation verdicts, most actionable first")
    List<MergedCorrelation> correlations;

    @Schema(description = "Detectors that raised during the run")
    List<DetectorFailure> failures;

    @Schema(description = "Detector scopes declined for lack of data")
    List<String> skipped;

    @Schema(description = "Error message when the run failed")
    String error;
}

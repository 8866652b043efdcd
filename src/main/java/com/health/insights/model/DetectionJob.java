package com.health.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Snapshot of a background detection job. Each state change produces a new instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Background detection job; poll until the status is terminal")
public class DetectionJob {

    @Schema(description = "Opaque job identifier", example = "2f7c9d1a-5b3e-4f60-8d2a-9c1e7b4a6f03")
    String jobId;

    @Schema(description = "User the job runs for", example = "user-42")
    String userId;

    @Schema(description = "Job lifecycle status", example = "RUNNING")
    JobStatus status;

    @Schema(description = "Status of the detection run once finished", example = "PARTIAL")
    RunStatus runStatus;

    @Schema(description = "Result batch produced by the job", example = "b3a4c1de-0f0e-4b6e-9a0d-2c8f5e7d1a90")
    String runId;

    @Schema(description = "Human readable progress message", example = "Running detectors")
    String message;

    @Schema(description = "Error message for failed jobs")
    String error;

    @Schema(description = "Creation time")
    Instant createdAt;

    @Schema(description = "Start time")
    Instant startedAt;

    @Schema(description = "Completion time")
    Instant completedAt;
}

package com.health.insights.controller;

import com.health.insights.model.DetectionJob;
import com.health.insights.model.DetectionRequest;
import com.health.insights.model.DetectionResult;
import com.health.insights.service.AnomalyDetectionService;
import com.health.insights.service.DetectionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Detection", description = "Start detection runs and poll background detection jobs")
public class DetectionController {

    private final DetectionJobService jobService;
    private final AnomalyDetectionService detectionService;

    public DetectionController(DetectionJobService jobService, AnomalyDetectionService detectionService) {
        this.jobService = jobService;
        this.detectionService = detectionService;
    }

    @PostMapping("/users/{userId}/detections")
    @Operation(summary = "Start a background detection job",
               description = "Returns immediately with a job id. Poll the job until its status is terminal, then fetch the result.")
    public ResponseEntity<DetectionJob> startDetection(@PathVariable String userId,
                                                       @RequestBody(required = false) DetectionRequest request) {
        DetectionJob job = jobService.submit(userId, request != null ? request : new DetectionRequest());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @PostMapping("/users/{userId}/anomalies/detect")
    @Operation(summary = "Run detection synchronously",
               description = "Runs all selected detectors over the window and returns total and new anomaly counts with the anomalies found")
    public ResponseEntity<DetectionResult> detectNow(@PathVariable String userId,
                                                     @RequestBody(required = false) DetectionRequest request) {
        return ResponseEntity.ok(detectionService.detect(userId, request != null ? request : new DetectionRequest()));
    }

    @GetMapping("/detections/jobs/{jobId}")
    @Operation(summary = "Get job status")
    public ResponseEntity<DetectionJob> getJob(@PathVariable String jobId) {
        return jobService.getJob(jobId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/detections/jobs/{jobId}")
    @Operation(summary = "Cancel a job",
               description = "Detectors not yet started are skipped and the job's output is discarded. Finished jobs are left unchanged.")
    public ResponseEntity<DetectionJob> cancelJob(@PathVariable String jobId) {
        return jobService.cancel(jobId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/detections/jobs/{jobId}/result")
    @Operation(summary = "Get the result of a finished job")
    public ResponseEntity<DetectionResult> getJobResult(@PathVariable String jobId) {
        return jobService.getResult(jobId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/users/{userId}/detections/jobs")
    @Operation(summary = "List a user's jobs", description = "Most recent first")
    public ResponseEntity<List<DetectionJob>> listJobs(@PathVariable String userId) {
        return ResponseEntity.ok(jobService.listJobs(userId));
    }
}

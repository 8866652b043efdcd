package com.health.insights.controller;

import com.health.insights.model.AnomalyResult;
import com.health.insights.model.AnomalySummary;
import com.health.insights.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/users/{userId}/anomalies")
@Tag(name = "Anomalies", description = "Stored point anomalies")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @GetMapping
    @Operation(summary = "List stored anomalies", description = "Most recent first. Optional date range.")
    public ResponseEntity<List<AnomalyResult>> getAnomalies(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(detectionService.getAnomalies(userId, from, to, limit));
    }

    @GetMapping("/summary")
    @Operation(summary = "Anomaly counts by severity and metric")
    public ResponseEntity<AnomalySummary> getSummary(@PathVariable String userId,
                                                     @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(detectionService.getSummary(userId, days));
    }
}

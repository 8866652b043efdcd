package com.health.insights.controller;

import com.health.insights.model.CorrelationSummary;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.service.CorrelationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users/{userId}/correlations")
@Tag(name = "Correlations", description = "Stored correlation verdicts between metric pairs")
public class CorrelationController {

    private final CorrelationService correlationService;

    public CorrelationController(CorrelationService correlationService) {
        this.correlationService = correlationService;
    }

    @GetMapping
    @Operation(summary = "List correlation verdicts", description = "Most actionable first")
    public ResponseEntity<List<MergedCorrelation>> getCorrelations(
            @PathVariable String userId,
            @RequestParam(defaultValue = "false") boolean actionableOnly,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(correlationService.getCorrelations(userId, actionableOnly, limit));
    }

    @GetMapping("/summary")
    @Operation(summary = "Correlation overview", description = "Totals by type and strength with the top findings")
    public ResponseEntity<CorrelationSummary> getSummary(@PathVariable String userId) {
        return ResponseEntity.ok(correlationService.getSummary(userId));
    }
}

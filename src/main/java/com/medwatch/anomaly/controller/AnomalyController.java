package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.AnomalyStatus;
import com.medwatch.anomaly.model.AnomalyStatusUpdate;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.service.DetectionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Query detected anomalies and record review decisions")
public class AnomalyController {

    private final DetectionOrchestrator orchestrator;

    public AnomalyController(DetectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "List recent anomalies",
            description = "Most recent first. Optional filters by severity, type and review status.")
    @GetMapping
    public ResponseEntity<?> listAnomalies(
            @Parameter(description = "low, medium, high or critical", example = "critical")
            @RequestParam(required = false) String severity,
            @Parameter(description = "Anomaly type", example = "shortage")
            @RequestParam(required = false) String type,
            @Parameter(description = "detected, investigating, resolved or false-positive", example = "detected")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            List<Anomaly> anomalies = orchestrator.getRecentAnomalies(limit,
                    Severity.fromLabel(severity), type, AnomalyStatus.fromLabel(status));
            return ResponseEntity.ok(anomalies);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get an anomaly by ID")
    @GetMapping("/{anomalyId}")
    public ResponseEntity<Anomaly> getAnomaly(
            @Parameter(description = "Anomaly ID", example = "ANOM-3f2a9c1e")
            @PathVariable String anomalyId) {
        return ResponseEntity.ok(orchestrator.getAnomaly(anomalyId));
    }

    @Operation(summary = "Update the review status of an anomaly",
            description = "Records the reviewer and review time.")
    @PutMapping("/{anomalyId}/status")
    public ResponseEntity<?> updateStatus(
            @Parameter(description = "Anomaly ID", example = "ANOM-3f2a9c1e")
            @PathVariable String anomalyId,
            @RequestBody AnomalyStatusUpdate update) {
        if (update.getStatus() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }
        Anomaly updated = orchestrator.updateAnomalyStatus(anomalyId, update.getStatus(), update.getReviewedBy());
        return ResponseEntity.ok(updated);
    }
}

package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.AcknowledgeRequest;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.AlertStatistics;
import com.medwatch.anomaly.service.AlertManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert history, acknowledgement and delivery statistics")
public class AlertController {

    private final AlertManager alertManager;

    public AlertController(AlertManager alertManager) {
        this.alertManager = alertManager;
    }

    @Operation(summary = "List recent alerts", description = "Most recent first.")
    @GetMapping
    public ResponseEntity<List<Alert>> listAlerts(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(alertManager.getRecentAlerts(limit));
    }

    @Operation(summary = "Get an alert by ID")
    @GetMapping("/{alertId}")
    public ResponseEntity<Alert> getAlert(
            @Parameter(description = "Alert ID", example = "ALERT-8c1d2e3f")
            @PathVariable String alertId) {
        return ResponseEntity.ok(alertManager.getAlert(alertId));
    }

    @Operation(summary = "Acknowledge an alert",
            description = "Cancels any pending retry or escalation for the alert.")
    @PostMapping("/{alertId}/acknowledge")
    public ResponseEntity<Alert> acknowledge(
            @Parameter(description = "Alert ID", example = "ALERT-8c1d2e3f")
            @PathVariable String alertId,
            @RequestBody(required = false) AcknowledgeRequest request) {
        String by = request != null && request.getAcknowledgedBy() != null ? request.getAcknowledgedBy() : "ops";
        return ResponseEntity.ok(alertManager.acknowledgeAlert(alertId, by));
    }

    @Operation(summary = "Alert statistics",
            description = "Counts by severity and status, average response time and queue depth.")
    @GetMapping("/statistics")
    public ResponseEntity<AlertStatistics> statistics() {
        return ResponseEntity.ok(alertManager.getAlertStats());
    }
}

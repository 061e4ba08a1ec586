package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.BatchResult;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.DetectorStatistics;
import com.medwatch.anomaly.model.ValidationResult;
import com.medwatch.anomaly.service.DetectionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/detector")
@Tag(name = "Detector", description = "Control the detection cycle and submit medicine data points")
public class DetectorController {

    private final DetectionOrchestrator orchestrator;

    public DetectorController(DetectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Start the periodic detection cycle",
            description = "Idempotent. Returns whether this call changed the state.")
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        boolean changed = orchestrator.start();
        return ResponseEntity.ok(state(changed));
    }

    @Operation(summary = "Stop the periodic detection cycle",
            description = "Idempotent. A batch already in progress completes.")
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean changed = orchestrator.stop();
        return ResponseEntity.ok(state(changed));
    }

    @Operation(summary = "Detector status")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        DetectorStatistics stats = orchestrator.getStatistics();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", stats.isRunning());
        body.put("queueSize", stats.getQueueSize());
        body.put("batchesProcessed", stats.getBatchesProcessed());
        body.put("lastBatchAt", stats.getLastBatchAt());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Run one detection batch now",
            description = "Processes everything currently pending in the submission queue and the data store.")
    @PostMapping("/batch")
    public ResponseEntity<BatchResult> runBatch() {
        return ResponseEntity.ok(orchestrator.processBatch());
    }

    @Operation(summary = "Submit a data point for detection",
            description = "The data point is validated and queued for the next batch. Invalid data points are rejected with 422.")
    @PostMapping("/data-points")
    public ResponseEntity<Map<String, Object>> submit(@RequestBody DataPoint dataPoint) {
        String id = orchestrator.submit(dataPoint);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("status", "queued");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @Operation(summary = "Validate a data point without queueing it")
    @PostMapping("/data-points/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody DataPoint dataPoint) {
        return ResponseEntity.ok(orchestrator.validate(dataPoint));
    }

    @Operation(summary = "Detection statistics",
            description = "Anomaly counts by type, detection method, severity and status, plus batch counters.")
    @GetMapping("/statistics")
    public ResponseEntity<DetectorStatistics> statistics() {
        return ResponseEntity.ok(orchestrator.getStatistics());
    }

    private Map<String, Object> state(boolean changed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", orchestrator.isRunning());
        body.put("changed", changed);
        return body;
    }
}

package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate view of the detection orchestrator")
public class DetectorStatistics {

    private boolean running;
    private long totalAnomalies;
    private long last24Hours;
    private Map<String, Long> byType;
    private Map<String, Long> byDetectionMethod;
    private Map<String, Long> bySeverity;
    private Map<String, Long> byStatus;
    private double averageConfidence;

    @Schema(description = "Data points waiting in the submission queue")
    private int queueSize;

    private long batchesProcessed;
    private long dataPointsProcessed;
    private Long lastBatchAt;
}

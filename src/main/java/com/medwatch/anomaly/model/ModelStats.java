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
@Schema(description = "Usage statistics of a scorer in the ensemble")
public class ModelStats {

    private String modelId;
    private String category;
    private String version;
    private Map<String, Object> parameters;
    private long totalPredictions;
    private double averageExecutionTimeMs;
    private double averageConfidence;
    private long anomaliesDetected;

    @Schema(description = "Percentage of predictions counted as detections")
    private double detectionRate;

    private Long lastUsed;
}

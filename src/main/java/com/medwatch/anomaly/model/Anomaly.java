package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A flagged deviation produced by a detection rule or the scoring ensemble")
public class Anomaly {

    @Schema(description = "Unique anomaly identifier", example = "ANOM-3f2a9c1e")
    private String id;

    @Schema(description = "How the anomaly was detected", example = "rule-based")
    private DetectionMethod detectionMethod;

    @Schema(description = "Ids of the rules or models that produced the detection")
    @Builder.Default
    private List<String> sourceIds = new ArrayList<>();

    @Schema(description = "Anomaly type", example = "complete_stockout")
    private String type;

    private Severity severity;

    @Schema(description = "Detection confidence between 0 and 1", example = "1.0")
    private double confidence;

    private String message;
    private String description;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @Builder.Default
    private List<String> causes = new ArrayList<>();

    private String dataPointId;
    private String medicineName;
    private String location;

    @Schema(description = "The data point the anomaly was detected on")
    private DataPoint dataPoint;

    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.DETECTED;

    @Schema(description = "Detection time in epoch milliseconds")
    private long detectedAt;

    private String reviewedBy;
    private Long reviewedAt;
}

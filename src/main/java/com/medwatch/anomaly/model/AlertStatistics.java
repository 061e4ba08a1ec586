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
@Schema(description = "Aggregate view of the alert history")
public class AlertStatistics {

    private long total;
    private long last24Hours;
    private Map<String, Long> bySeverity;
    private Map<String, Long> byStatus;

    @Schema(description = "Average of processedAt - createdAt in milliseconds over processed alerts")
    private double averageResponseTimeMs;

    private int queueSize;
}

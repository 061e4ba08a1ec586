package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outbound notification lifecycle for one anomaly, or for a batch of anomalies
 * that share severity and batching interval. Mutated only while holding its own monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notification lifecycle derived from one or more anomalies")
public class Alert {

    @Schema(description = "Unique alert identifier", example = "ALERT-8c1d2e3f")
    private String id;

    @Schema(description = "Triggering anomaly. Null for batch alerts.")
    private Anomaly anomaly;

    @Schema(description = "Member anomalies of a batch alert")
    @Builder.Default
    private List<Anomaly> batchMembers = new ArrayList<>();

    private boolean batch;

    @Schema(description = "Id of the batch alert this alert was delivered with")
    private String batchId;

    private Severity severity;
    private AlertRule rule;

    @Builder.Default
    private AlertStatus status = AlertStatus.PENDING;

    private int attempts;
    private int maxAttempts;

    @Builder.Default
    private List<NotificationResult> notifications = new ArrayList<>();

    private String error;

    private long createdAt;
    private Long processedAt;
    private Long escalatedAt;
    private Long acknowledgedAt;
    private String acknowledgedBy;
}

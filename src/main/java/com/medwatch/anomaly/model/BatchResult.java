package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    private int fetched;
    private int processed;
    private int alertsForwarded;
    private long durationMs;

    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    public static BatchResult empty() {
        return new BatchResult();
    }
}

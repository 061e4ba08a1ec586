package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of a single scorer for a single data point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResult {

    private boolean anomaly;
    private double confidence;
    private String type;
    private String message;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @Builder.Default
    private List<String> causes = new ArrayList<>();

    public static ScoreResult normal() {
        return ScoreResult.builder().anomaly(false).confidence(0.0).build();
    }

    public static ScoreResult insufficientData(String reason) {
        ScoreResult result = normal();
        result.getDetails().put("reason", reason);
        return result;
    }
}

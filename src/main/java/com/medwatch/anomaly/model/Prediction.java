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
@Schema(description = "Combined verdict of the scoring ensemble for one data point")
public class Prediction {

    private String dataPointId;
    private boolean anomaly;

    @Schema(description = "Weighted average of the confidences of the scorers that flagged an anomaly")
    private double confidence;

    private Severity severity;
    private String type;
    private String message;

    @Builder.Default
    private List<String> causes = new ArrayList<>();

    @Schema(description = "Per-model details keyed by model id")
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @Schema(description = "Votes of every scorer that ran, including non-anomalous ones")
    @Builder.Default
    private List<ModelVote> votes = new ArrayList<>();

    public List<String> getContributingModels() {
        List<String> ids = new ArrayList<>();
        for (ModelVote vote : votes) {
            if (vote.getResult() != null && vote.getResult().isAnomaly()) {
                ids.add(vote.getModelId());
            }
        }
        return ids;
    }
}

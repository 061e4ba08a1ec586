package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scorer's result tagged with the scorer's identity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVote {

    private String modelId;
    private String category;
    private ScoreResult result;
}

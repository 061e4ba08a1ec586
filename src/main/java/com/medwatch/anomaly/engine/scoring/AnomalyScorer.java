package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.ScoreResult;

import java.util.Map;

/**
 * A heuristic model in the scoring ensemble.
 * Each implementation is identified by a model id that also selects its combination weight.
 */
public interface AnomalyScorer {

    String getModelId();

    String getCategory();

    String getVersion();

    /**
     * Fixed tuning parameters reported with the model statistics.
     */
    Map<String, Object> getParameters();

    /**
     * Score a single data point. Must not mutate the input.
     *
     * @param dataPoint the enriched data point
     * @return the verdict; a non-anomalous result when the history is too short
     */
    ScoreResult score(EnrichedDataPoint dataPoint);
}

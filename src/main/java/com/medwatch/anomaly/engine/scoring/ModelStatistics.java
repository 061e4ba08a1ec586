package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.model.ModelStats;

/**
 * Usage counters of one scorer. All access is synchronized on the instance.
 */
class ModelStatistics {

    private long totalPredictions;
    private double averageExecutionTimeMs;
    private double averageConfidence;
    private long anomaliesDetected;
    private Long lastUsed;

    synchronized void record(double elapsedMs, double confidence, boolean detected, long timestamp) {
        totalPredictions++;
        averageExecutionTimeMs = (averageExecutionTimeMs * (totalPredictions - 1) + elapsedMs) / totalPredictions;
        averageConfidence = (averageConfidence * (totalPredictions - 1) + confidence) / totalPredictions;
        if (detected) anomaliesDetected++;
        lastUsed = timestamp;
    }

    synchronized ModelStats snapshot(AnomalyScorer scorer) {
        return ModelStats.builder()
                .modelId(scorer.getModelId())
                .category(scorer.getCategory())
                .version(scorer.getVersion())
                .parameters(scorer.getParameters())
                .totalPredictions(totalPredictions)
                .averageExecutionTimeMs(averageExecutionTimeMs)
                .averageConfidence(averageConfidence)
                .anomaliesDetected(anomaliesDetected)
                .detectionRate(totalPredictions > 0 ? (double) anomaliesDetected / totalPredictions * 100.0 : 0.0)
                .lastUsed(lastUsed)
                .build();
    }
}

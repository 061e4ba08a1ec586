package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.config.ScoringConfig;
import com.medwatch.anomaly.exception.ScorerException;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.ModelStats;
import com.medwatch.anomaly.model.ModelVote;
import com.medwatch.anomaly.model.Prediction;
import com.medwatch.anomaly.model.ScoreResult;
import com.medwatch.anomaly.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Runs every registered scorer against each data point and combines the anomalous votes
 * into one {@link Prediction}.
 *
 * Combination: weighted average of the confidences of the anomalous votes, using the
 * per-model weights of {@link ScoringConfig}. Votes are summed in model-id order so the
 * result does not depend on scorer order. The prediction is anomalous when the combined
 * confidence exceeds the configured threshold (0.5 by default).
 */
@Component
public class ScoringEnsemble {

    private static final Logger log = LoggerFactory.getLogger(ScoringEnsemble.class);

    private final Map<String, RegisteredScorer> scorers = new LinkedHashMap<>();
    private final ScoringConfig scoringConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ScoringEnsemble(List<AnomalyScorer> scorers, ScoringConfig scoringConfig,
                           MetricsConfig metricsConfig, Clock clock) {
        this.scoringConfig = scoringConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        for (AnomalyScorer scorer : scorers) {
            this.scorers.put(scorer.getModelId(), new RegisteredScorer(scorer));
        }
        log.info("Scoring ensemble initialized with {} models: {}", this.scorers.size(), this.scorers.keySet());
    }

    @Observed(name = "scoring.predict", contextualName = "ensemble-predict")
    public List<Prediction> predict(List<EnrichedDataPoint> dataPoints) {
        List<Prediction> predictions = new ArrayList<>(dataPoints.size());
        for (EnrichedDataPoint dataPoint : dataPoints) {
            predictions.add(predict(dataPoint));
        }
        return predictions;
    }

    /**
     * Run all scorers on one data point. A failing scorer is logged and left out of the vote.
     */
    public Prediction predict(EnrichedDataPoint dataPoint) {
        List<ModelVote> votes = new ArrayList<>();
        for (RegisteredScorer registered : scorers.values()) {
            AnomalyScorer scorer = registered.scorer;
            long start = System.nanoTime();
            try {
                ScoreResult result = scorer.score(dataPoint);
                double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
                registered.stats.record(elapsedMs, result.getConfidence(),
                        result.getConfidence() > scoringConfig.getDetectionThreshold(), clock.millis());

                if (result.isAnomaly()) {
                    metricsConfig.recordModelDetection(scorer.getModelId());
                    log.debug("Model {} flagged data point {} (confidence={})",
                            scorer.getModelId(), dataPoint.getId(), result.getConfidence());
                }
                votes.add(ModelVote.builder()
                        .modelId(scorer.getModelId())
                        .category(scorer.getCategory())
                        .result(result)
                        .build());
            } catch (RuntimeException e) {
                ScorerException failure = new ScorerException(scorer.getModelId(), e);
                log.error("Error running model {} on data point {}: {}",
                        scorer.getModelId(), dataPoint.getId(), failure.getMessage(), failure);
            }
        }

        Prediction prediction = combine(votes);
        prediction.setDataPointId(dataPoint.getId());
        return prediction;
    }

    /**
     * Combine votes into a prediction. Only anomalous votes contribute; with none the
     * prediction is non-anomalous with zero confidence.
     */
    public Prediction combine(List<ModelVote> votes) {
        List<ModelVote> positive = new ArrayList<>();
        for (ModelVote vote : votes) {
            if (vote.getResult() != null && vote.getResult().isAnomaly()) {
                positive.add(vote);
            }
        }
        if (positive.isEmpty()) {
            return Prediction.builder()
                    .anomaly(false)
                    .confidence(0.0)
                    .severity(Severity.LOW)
                    .votes(new ArrayList<>(votes))
                    .build();
        }
        positive.sort(Comparator.comparing(ModelVote::getModelId));

        double weighted = 0.0;
        double totalWeight = 0.0;
        StringJoiner types = new StringJoiner(", ");
        StringJoiner messages = new StringJoiner(" | ");
        Set<String> causes = new LinkedHashSet<>();
        Map<String, Object> details = new LinkedHashMap<>();

        for (ModelVote vote : positive) {
            ScoreResult result = vote.getResult();
            double weight = scoringConfig.weightFor(vote.getModelId());
            weighted += result.getConfidence() * weight;
            totalWeight += weight;
            if (result.getType() != null) types.add(result.getType());
            if (result.getMessage() != null) messages.add(result.getMessage());
            causes.addAll(result.getCauses());
            details.put(vote.getModelId(), result.getDetails());
        }

        double confidence = totalWeight > 0 ? weighted / totalWeight : 0.0;
        return Prediction.builder()
                .anomaly(confidence > scoringConfig.getAnomalyThreshold())
                .confidence(confidence)
                .severity(Severity.fromConfidence(confidence))
                .type(types.toString())
                .message(messages.toString())
                .causes(new ArrayList<>(causes))
                .details(details)
                .votes(new ArrayList<>(votes))
                .build();
    }

    /**
     * Statistics of every scorer keyed by model id, with a detection rate in percent.
     */
    public Map<String, ModelStats> getModelStats() {
        Map<String, ModelStats> stats = new LinkedHashMap<>();
        for (RegisteredScorer registered : scorers.values()) {
            stats.put(registered.scorer.getModelId(), registered.stats.snapshot(registered.scorer));
        }
        return stats;
    }

    public int getModelCount() {
        return scorers.size();
    }

    private static final class RegisteredScorer {
        final AnomalyScorer scorer;
        final ModelStatistics stats = new ModelStatistics();

        RegisteredScorer(AnomalyScorer scorer) {
            this.scorer = scorer;
        }
    }
}

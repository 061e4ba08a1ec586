package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.config.ScoringConfig;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.ModelStats;
import com.medwatch.anomaly.model.ModelVote;
import com.medwatch.anomaly.model.Prediction;
import com.medwatch.anomaly.model.ScoreResult;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.medwatch.anomaly.testutil.TestDataFactory.anomalous;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEnsembleTest {

    private ScoringConfig config;
    private EnrichedDataPoint healthy;

    @BeforeEach
    void setUp() {
        config = new ScoringConfig();
        healthy = TestDataFactory.enrich(TestDataFactory.createHealthyDataPoint("DP-1", "Insulin", "Delhi"));
    }

    private ScoringEnsemble ensemble(AnomalyScorer... scorers) {
        return new ScoringEnsemble(List.of(scorers), config, TestDataFactory.metrics(), TestDataFactory.fixedClock());
    }

    private static ModelVote vote(String modelId, ScoreResult result) {
        return ModelVote.builder().modelId(modelId).category("test").result(result).build();
    }

    @Test
    void noAnomalousVotes_givesLowNonAnomaly() {
        Prediction prediction = ensemble().combine(List.of(
                vote("time-series-anomaly", ScoreResult.normal()),
                vote("isolation-forest", ScoreResult.builder().anomaly(false).confidence(0.4).build())));

        assertThat(prediction.isAnomaly()).isFalse();
        assertThat(prediction.getConfidence()).isZero();
        assertThat(prediction.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(prediction.getVotes()).hasSize(2);
        assertThat(prediction.getContributingModels()).isEmpty();
    }

    @Test
    void weightedAverageOverAnomalousVotes() {
        Prediction prediction = ensemble().combine(List.of(
                vote("time-series-anomaly", anomalous(0.9, "Time Series Anomaly")),
                vote("price-anomaly", anomalous(0.5, "Price Anomaly")),
                vote("demand-forecast", ScoreResult.builder().anomaly(false).confidence(0.3).build())));

        // (0.9 * 0.3 + 0.5 * 0.2) / 0.5
        assertThat(prediction.getConfidence()).isCloseTo(0.74, within(1e-9));
        assertThat(prediction.isAnomaly()).isTrue();
        assertThat(prediction.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(prediction.getType()).isEqualTo("Price Anomaly, Time Series Anomaly");
        assertThat(prediction.getMessage()).isEqualTo("Price Anomaly detected | Time Series Anomaly detected");
        assertThat(prediction.getDetails()).containsOnlyKeys("price-anomaly", "time-series-anomaly");
        assertThat(prediction.getCauses()).containsExactly("Price Anomaly cause", "Time Series Anomaly cause");
        assertThat(prediction.getContributingModels()).containsExactly("time-series-anomaly", "price-anomaly");
    }

    @Test
    void combine_isIndependentOfVoteOrder() {
        List<ModelVote> votes = new ArrayList<>(List.of(
                vote("time-series-anomaly", anomalous(0.9, "A")),
                vote("isolation-forest", anomalous(0.65, "B")),
                vote("price-anomaly", anomalous(0.5, "C"))));
        Prediction forward = ensemble().combine(votes);
        Collections.reverse(votes);
        Prediction reversed = ensemble().combine(votes);

        assertThat(reversed.getConfidence()).isEqualTo(forward.getConfidence());
        assertThat(reversed.getType()).isEqualTo(forward.getType());
        assertThat(reversed.getMessage()).isEqualTo(forward.getMessage());
    }

    @Test
    void unknownModel_usesDefaultWeight() {
        Prediction prediction = ensemble().combine(List.of(
                vote("custom-model", anomalous(1.0, "Custom")),
                vote("time-series-anomaly", anomalous(0.6, "Time Series"))));

        // (1.0 * 0.1 + 0.6 * 0.3) / 0.4
        assertThat(prediction.getConfidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void combinedConfidenceAtThreshold_isNotAnomalous() {
        Prediction prediction = ensemble().combine(List.of(vote("price-anomaly", anomalous(0.5, "Price Anomaly"))));

        assertThat(prediction.getConfidence()).isEqualTo(0.5);
        assertThat(prediction.isAnomaly()).isFalse();
        assertThat(prediction.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void failingScorer_isSkipped() {
        ScoringEnsemble ensemble = ensemble(
                new StubScorer("time-series-anomaly", dp -> anomalous(0.8, "Time Series Anomaly")),
                new StubScorer("isolation-forest", dp -> {
                    throw new IllegalStateException("boom");
                }));

        Prediction prediction = ensemble.predict(healthy);

        assertThat(prediction.getDataPointId()).isEqualTo("DP-1");
        assertThat(prediction.getVotes()).extracting(ModelVote::getModelId).containsExactly("time-series-anomaly");
        assertThat(prediction.getConfidence()).isCloseTo(0.8, within(1e-9));
        assertThat(ensemble.getModelStats().get("isolation-forest").getTotalPredictions()).isZero();
    }

    @Test
    void predict_recordsModelStatistics() {
        double[] confidences = {0.9, 0.2, 0.6, 0.5};
        int[] call = {0};
        ScoringEnsemble ensemble = ensemble(new StubScorer("demand-forecast", dp -> {
            double c = confidences[call[0]++];
            return ScoreResult.builder().anomaly(c > 0.4).confidence(c).build();
        }));

        ensemble.predict(List.of(healthy, healthy, healthy, healthy));

        ModelStats stats = ensemble.getModelStats().get("demand-forecast");
        assertThat(stats.getTotalPredictions()).isEqualTo(4);
        assertThat(stats.getAnomaliesDetected()).isEqualTo(2);
        assertThat(stats.getDetectionRate()).isCloseTo(50.0, within(1e-9));
        assertThat(stats.getAverageConfidence()).isCloseTo(0.55, within(1e-9));
        assertThat(stats.getLastUsed()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(stats.getParameters()).containsEntry("stub", true);
        assertThat(ensemble.getModelCount()).isEqualTo(1);
    }

    @Test
    void builtInScorers_stayQuietOnHealthyData() {
        ScoringEnsemble ensemble = ensemble(new TimeSeriesScorer(), new IsolationScorer(),
                new PriceScorer(), new DemandScorer());

        Prediction prediction = ensemble.predict(healthy);

        assertThat(prediction.isAnomaly()).isFalse();
        assertThat(prediction.getVotes()).hasSize(4);
        assertThat(ensemble.getModelStats()).containsOnlyKeys(
                "time-series-anomaly", "isolation-forest", "price-anomaly", "demand-forecast");
    }

    private static final class StubScorer implements AnomalyScorer {
        private final String modelId;
        private final Function<EnrichedDataPoint, ScoreResult> behavior;

        StubScorer(String modelId, Function<EnrichedDataPoint, ScoreResult> behavior) {
            this.modelId = modelId;
            this.behavior = behavior;
        }

        @Override
        public String getModelId() {
            return modelId;
        }

        @Override
        public String getCategory() {
            return "stub";
        }

        @Override
        public String getVersion() {
            return "0.0.1";
        }

        @Override
        public Map<String, Object> getParameters() {
            return Map.of("stub", true);
        }

        @Override
        public ScoreResult score(EnrichedDataPoint dataPoint) {
            return behavior.apply(dataPoint);
        }
    }
}

package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.ScoreResult;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static com.medwatch.anomaly.testutil.TestDataFactory.list;
import static org.assertj.core.api.Assertions.assertThat;

class TimeSeriesScorerTest {

    private final TimeSeriesScorer scorer = new TimeSeriesScorer();

    private ScoreResult score(DataPoint dp) {
        return scorer.score(TestDataFactory.enrich(dp));
    }

    private static DataPoint.DataPointBuilder healthy() {
        return TestDataFactory.createHealthyDataPoint("DP-1", "Insulin", "Delhi").toBuilder();
    }

    @Test
    void stockNearRecentMean_isNormal() {
        ScoreResult result = score(healthy().build());

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getConfidence()).isZero();
    }

    @Test
    void stockFarFromRecentMean_isAnomalous() {
        ScoreResult result = score(healthy().currentStock(0.0).build());

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getType()).isEqualTo("Time Series Anomaly");
        assertThat((double) result.getDetails().get("zScore")).isGreaterThan(TimeSeriesScorer.Z_THRESHOLD);
        assertThat(result.getCauses()).contains("supply chain bottleneck");
    }

    @Test
    void justInsideThreshold_isNormal() {
        // mean 500, population stdDev ~6.07
        assertThat(score(healthy().currentStock(515.0).build()).isAnomaly()).isFalse();
        assertThat(score(healthy().currentStock(517.0).build()).isAnomaly()).isTrue();
    }

    @Test
    void flatHistory_neverFlags() {
        DataPoint dp = healthy().stockHistory(list(100, 100, 100, 100, 100, 100, 100)).currentStock(0.0).build();

        assertThat(score(dp).isAnomaly()).isFalse();
    }

    @Test
    void shortHistory_isInsufficientData() {
        ScoreResult result = score(healthy().stockHistory(list(1, 2, 3, 4, 5, 6)).currentStock(0.0).build());

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDetails()).containsEntry("reason", "Insufficient stock history");
    }
}

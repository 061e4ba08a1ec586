package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.ScoreResult;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.medwatch.anomaly.testutil.TestDataFactory.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DemandScorerTest {

    private final DemandScorer scorer = new DemandScorer();

    private ScoreResult score(DataPoint dp) {
        return scorer.score(TestDataFactory.enrich(dp));
    }

    private static DataPoint.DataPointBuilder healthy() {
        return TestDataFactory.createHealthyDataPoint("DP-1", "Insulin", "Delhi").toBuilder();
    }

    @Test
    void demandAtExpected_isNormal() {
        assertThat(score(healthy().build()).isAnomaly()).isFalse();
    }

    @Test
    void demandFarAboveExpected_isAnomalous() {
        ScoreResult result = score(healthy().currentDemand(160.0).build());

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getConfidence()).isCloseTo(0.6, within(1e-9));
        assertThat(result.getDetails()).containsEntry("expectedDemand", 100.0);
    }

    @Test
    void seasonalFactorRaisesExpectation() {
        ScoreResult result = score(healthy().currentDemand(160.0).seasonalFactors(Map.of(1, 1.5)).build());

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getConfidence()).isCloseTo(10.0 / 150, within(1e-9));
    }

    @Test
    void deviationCapsAtOne() {
        assertThat(score(healthy().currentDemand(500.0).build()).getConfidence()).isEqualTo(1.0);
    }

    @Test
    void shortHistoryOrNoCurrentDemand_isInsufficientData() {
        assertThat(score(healthy().demandHistory(list(100, 100, 100)).build()).getDetails())
                .containsEntry("reason", "Insufficient demand history");
        assertThat(score(healthy().currentDemand(null).build()).getDetails())
                .containsEntry("reason", "Insufficient demand history");
    }
}

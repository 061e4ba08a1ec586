package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.DetectionConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.config.ScoringConfig;
import com.medwatch.anomaly.engine.feature.FeatureProcessor;
import com.medwatch.anomaly.engine.rules.DetectionRule;
import com.medwatch.anomaly.engine.rules.RuleEngine;
import com.medwatch.anomaly.engine.rules.condition.PredicateCondition;
import com.medwatch.anomaly.engine.rules.sets.PriceRuleSet;
import com.medwatch.anomaly.engine.rules.sets.ShortageRuleSet;
import com.medwatch.anomaly.engine.scoring.DemandScorer;
import com.medwatch.anomaly.engine.scoring.IsolationScorer;
import com.medwatch.anomaly.engine.scoring.PriceScorer;
import com.medwatch.anomaly.engine.scoring.ScoringEnsemble;
import com.medwatch.anomaly.engine.scoring.TimeSeriesScorer;
import com.medwatch.anomaly.exception.AnomalyNotFoundException;
import com.medwatch.anomaly.exception.DataPointValidationException;
import com.medwatch.anomaly.model.*;
import com.medwatch.anomaly.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionOrchestratorTest {

    @Mock private AnomalyStore anomalyStore;
    @Mock private AnomalyAlertChannel alertChannel;

    private DetectionConfig config;
    private DataPointSubmissionQueue queue;
    private RuleEngine ruleEngine;
    private DetectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        config.setAutoStart(false);
        config.setWorkerThreads(2);
        orchestrator = newOrchestrator();
        orchestrator.init();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private DetectionOrchestrator newOrchestrator() {
        Clock clock = TestDataFactory.fixedClock();
        MetricsConfig metrics = TestDataFactory.metrics();
        ruleEngine = new RuleEngine(List.of(new ShortageRuleSet(), new PriceRuleSet()),
                Tracer.NOOP, metrics, clock);
        ScoringEnsemble ensemble = new ScoringEnsemble(
                List.of(new TimeSeriesScorer(), new IsolationScorer(), new PriceScorer(), new DemandScorer()),
                new ScoringConfig(), metrics, clock);
        queue = new DataPointSubmissionQueue();
        return new DetectionOrchestrator(new FeatureProcessor(config, clock, metrics), ruleEngine, ensemble,
                List.of(queue), queue, anomalyStore, alertChannel, config, metrics, clock);
    }

    @Test
    void stockout_yieldsOneCriticalRuleAnomaly_andAlerts() {
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));

        BatchResult result = orchestrator.processBatch();

        assertThat(result.getFetched()).isEqualTo(1);
        assertThat(result.getProcessed()).isEqualTo(1);
        assertThat(result.getAlertsForwarded()).isEqualTo(1);
        assertThat(result.getAnomalies()).hasSize(1);

        Anomaly anomaly = result.getAnomalies().get(0);
        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.RULE_BASED);
        assertThat(anomaly.getSourceIds()).containsExactly("complete-stockout");
        assertThat(anomaly.getType()).isEqualTo("shortage");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getConfidence()).isEqualTo(1.0);
        assertThat(anomaly.getStatus()).isEqualTo(AnomalyStatus.DETECTED);
        assertThat(anomaly.getDataPointId()).isEqualTo("DP-1");
        assertThat(anomaly.getMessage()).isEqualTo("STOCKOUT: Insulin is completely out of stock at Delhi");
        assertThat(anomaly.getDetectedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());

        verify(anomalyStore).save(anomaly);
        verify(alertChannel).sendAlert(anomaly);
        assertThat(queue.size()).isZero();
    }

    @Test
    void ruleWithoutSeverity_doesNotDiscardOtherDetections() {
        ruleEngine.addRule(DetectionRule.builder()
                .id("always-match")
                .name("Always match")
                .category("custom")
                .condition(PredicateCondition.of("always", ctx -> true))
                .action(ctx -> AnomalyDetails.builder().message("custom match").build())
                .build());
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));

        BatchResult result = orchestrator.processBatch();

        assertThat(result.getAnomalies())
                .extracting(a -> a.getSourceIds().get(0))
                .containsExactlyInAnyOrder("complete-stockout", "always-match");
        Anomaly custom = result.getAnomalies().stream()
                .filter(a -> a.getSourceIds().contains("always-match"))
                .findFirst().orElseThrow();
        assertThat(custom.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(custom.getConfidence()).isEqualTo(0.6);
    }

    @Test
    void healthyDataPoint_yieldsNothing() {
        orchestrator.submit(TestDataFactory.createHealthyDataPoint("DP-1", "Paracetamol", "Pune"));

        BatchResult result = orchestrator.processBatch();

        assertThat(result.getProcessed()).isEqualTo(1);
        assertThat(result.getAnomalies()).isEmpty();
        verifyNoInteractions(alertChannel);
    }

    @Test
    void demandSurge_yieldsMlAnomalyBelowAlertThreshold() {
        DataPoint surge = TestDataFactory.createHealthyDataPoint("DP-1", "Insulin", "Delhi").toBuilder()
                .currentDemand(160.0)
                .build();
        orchestrator.submit(surge);

        BatchResult result = orchestrator.processBatch();

        assertThat(result.getAnomalies()).hasSize(1);
        Anomaly anomaly = result.getAnomalies().get(0);
        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.ML_BASED);
        assertThat(anomaly.getSourceIds()).containsExactly("demand-forecast");
        assertThat(anomaly.getType()).isEqualTo("Demand Anomaly");
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(result.getAlertsForwarded()).isZero();
        verify(anomalyStore).save(anomaly);
        verifyNoInteractions(alertChannel);
    }

    @Test
    void disabledStages_areSkipped() {
        config.setRuleEngineEnabled(false);
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));

        assertThat(orchestrator.processBatch().getAnomalies()).isEmpty();
    }

    @Test
    void submit_invalidDataPoint_isRejected() {
        DataPoint invalid = TestDataFactory.createStockoutDataPoint("DP-BAD").toBuilder()
                .currentStock(-5.0)
                .timestamp("not-a-time")
                .build();

        assertThatThrownBy(() -> orchestrator.submit(invalid))
                .isInstanceOf(DataPointValidationException.class)
                .satisfies(e -> assertThat(((DataPointValidationException) e).getErrors())
                        .contains("currentStock must not be negative", "Invalid timestamp: not-a-time"));
        assertThat(queue.size()).isZero();
    }

    @Test
    void submit_assignsIdWhenMissing() {
        DataPoint withoutId = TestDataFactory.createStockoutDataPoint(null);

        String id = orchestrator.submit(withoutId);

        assertThat(id).isNotBlank();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void emptyBatch_returnsEmptyResult() {
        BatchResult result = orchestrator.processBatch();

        assertThat(result.getFetched()).isZero();
        assertThat(orchestrator.getStatistics().getBatchesProcessed()).isZero();
    }

    @Test
    void failingStore_doesNotStopAlerting() {
        doThrow(new IllegalStateException("store down")).when(anomalyStore).save(any());
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));

        BatchResult result = orchestrator.processBatch();

        assertThat(result.getAlertsForwarded()).isEqualTo(1);
        assertThat(orchestrator.getRecentAnomalies(10, null, null, null)).hasSize(1);
    }

    @Test
    void updateAnomalyStatus_recordsReview() {
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));
        String anomalyId = orchestrator.processBatch().getAnomalies().get(0).getId();

        Anomaly updated = orchestrator.updateAnomalyStatus(anomalyId, AnomalyStatus.FALSE_POSITIVE, "pharmacist");

        assertThat(updated.getStatus()).isEqualTo(AnomalyStatus.FALSE_POSITIVE);
        assertThat(updated.getReviewedBy()).isEqualTo("pharmacist");
        assertThat(updated.getReviewedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        verify(anomalyStore).updateStatus(updated);
        assertThat(orchestrator.getAnomaly(anomalyId).getStatus()).isEqualTo(AnomalyStatus.FALSE_POSITIVE);
    }

    @Test
    void getAnomaly_fallsBackToStore() {
        Anomaly stored = TestDataFactory.createAnomaly("ANOM-OLD", Severity.HIGH, 0.8);
        when(anomalyStore.findById("ANOM-OLD")).thenReturn(Optional.of(stored));

        assertThat(orchestrator.getAnomaly("ANOM-OLD")).isSameAs(stored);
    }

    @Test
    void getAnomaly_unknownId_throwsNotFound() {
        when(anomalyStore.findById("ANOM-MISSING")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.getAnomaly("ANOM-MISSING"))
                .isInstanceOf(AnomalyNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.updateAnomalyStatus("ANOM-MISSING", AnomalyStatus.RESOLVED, "ops"))
                .isInstanceOf(AnomalyNotFoundException.class);
    }

    @Test
    void init_restoresHistoryNewestFirst() {
        orchestrator.shutdown();
        Anomaly newer = TestDataFactory.createAnomaly("ANOM-2", Severity.HIGH, 0.8);
        Anomaly older = TestDataFactory.createAnomaly("ANOM-1", Severity.LOW, 0.3);
        when(anomalyStore.list(config.getHistoryLimit())).thenReturn(List.of(newer, older));

        orchestrator = newOrchestrator();
        orchestrator.init();

        assertThat(orchestrator.getRecentAnomalies(10, null, null, null))
                .extracting(Anomaly::getId).containsExactly("ANOM-2", "ANOM-1");
    }

    @Test
    void getRecentAnomalies_appliesFiltersAndLimit() {
        orchestrator.shutdown();
        Anomaly critical = TestDataFactory.createAnomaly("ANOM-3", Severity.CRITICAL, 1.0);
        Anomaly high = TestDataFactory.createAnomaly("ANOM-2", Severity.HIGH, 0.8);
        high.setStatus(AnomalyStatus.RESOLVED);
        Anomaly low = TestDataFactory.createAnomaly("ANOM-1", Severity.LOW, 0.3);
        low.setType("price");
        when(anomalyStore.list(anyInt())).thenReturn(List.of(critical, high, low));
        orchestrator = newOrchestrator();
        orchestrator.init();

        assertThat(orchestrator.getRecentAnomalies(2, null, null, null))
                .extracting(Anomaly::getId).containsExactly("ANOM-3", "ANOM-2");
        assertThat(orchestrator.getRecentAnomalies(10, Severity.HIGH, null, null))
                .extracting(Anomaly::getId).containsExactly("ANOM-2");
        assertThat(orchestrator.getRecentAnomalies(10, null, "PRICE", null))
                .extracting(Anomaly::getId).containsExactly("ANOM-1");
        assertThat(orchestrator.getRecentAnomalies(10, null, null, AnomalyStatus.DETECTED))
                .extracting(Anomaly::getId).containsExactly("ANOM-3", "ANOM-1");
    }

    @Test
    void getStatistics_countsByDimension() {
        orchestrator.submit(TestDataFactory.createStockoutDataPoint("DP-1"));
        orchestrator.submit(TestDataFactory.createHealthyDataPoint("DP-2", "Insulin", "Delhi").toBuilder()
                .currentDemand(160.0).build());
        orchestrator.processBatch();

        DetectorStatistics stats = orchestrator.getStatistics();

        assertThat(stats.getTotalAnomalies()).isEqualTo(2);
        assertThat(stats.getLast24Hours()).isEqualTo(2);
        assertThat(stats.getByDetectionMethod()).containsEntry("rule-based", 1L).containsEntry("ml-based", 1L);
        assertThat(stats.getBySeverity()).containsEntry("critical", 1L).containsEntry("medium", 1L);
        assertThat(stats.getByStatus()).containsEntry("detected", 2L);
        assertThat(stats.getAverageConfidence()).isCloseTo(0.8, within(1e-9));
        assertThat(stats.getBatchesProcessed()).isEqualTo(1);
        assertThat(stats.getDataPointsProcessed()).isEqualTo(2);
        assertThat(stats.getLastBatchAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(stats.isRunning()).isFalse();
    }

    @Test
    void startAndStop_areIdempotent() {
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(orchestrator.start()).isTrue();
        assertThat(orchestrator.start()).isFalse();
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.stop()).isTrue();
        assertThat(orchestrator.stop()).isFalse();
        assertThat(orchestrator.isRunning()).isFalse();
    }
}

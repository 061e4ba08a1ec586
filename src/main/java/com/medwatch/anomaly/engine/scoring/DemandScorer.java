package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.engine.feature.SeriesStatistics;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.ScoreResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares current demand against the seasonally adjusted mean of the last 7 demand samples.
 */
@Component
public class DemandScorer implements AnomalyScorer {

    static final int WINDOW = 7;
    static final double THRESHOLD = 0.4;

    @Override
    public String getModelId() {
        return "demand-forecast";
    }

    @Override
    public String getCategory() {
        return "forecasting";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("windowSize", WINDOW);
        params.put("deviationThreshold", THRESHOLD);
        params.put("seasonalFactors", true);
        return params;
    }

    @Override
    public ScoreResult score(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        List<Double> history = dp.getDemandHistory();
        if (history == null || history.size() < WINDOW || dp.getCurrentDemand() == null) {
            return ScoreResult.insufficientData("Insufficient demand history");
        }

        double seasonal = enriched.getContextual() != null ? enriched.getContextual().getSeasonalFactor() : 1.0;
        double expected = SeriesStatistics.mean(SeriesStatistics.trailing(history, WINDOW)) * seasonal;
        double current = dp.getCurrentDemand();
        double deviation = expected > 0 ? Math.abs(current - expected) / expected : 0.0;

        if (deviation <= THRESHOLD) {
            return ScoreResult.builder().anomaly(false).confidence(deviation).build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentDemand", current);
        details.put("expectedDemand", expected);
        details.put("demandDeviation", deviation);
        details.put("seasonalAdjustment", seasonal);
        details.put("medicineName", dp.getMedicineName());
        details.put("medicineId", dp.getMedicineId());

        return ScoreResult.builder()
                .anomaly(true)
                .confidence(Math.min(deviation, 1.0))
                .type("Demand Anomaly")
                .message(String.format("ML Anomaly: %s demand deviation %.1f%% from expected.",
                        dp.getMedicineName(), deviation * 100))
                .details(details)
                .causes(List.of("unexpected demand fluctuation", "seasonal peak", "disease outbreak",
                        "public health campaign"))
                .build();
    }
}

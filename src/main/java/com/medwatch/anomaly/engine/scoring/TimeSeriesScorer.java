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
 * Flags a current stock level that sits far from the recent stock history.
 *
 * z = |currentStock - mean(last 7)| / stdDev(last 7), anomalous above 2.5.
 * A flat history (stdDev = 0) gives z = 0.
 */
@Component
public class TimeSeriesScorer implements AnomalyScorer {

    static final int WINDOW = 7;
    static final double Z_THRESHOLD = 2.5;

    @Override
    public String getModelId() {
        return "time-series-anomaly";
    }

    @Override
    public String getCategory() {
        return "time-series";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("windowSize", WINDOW);
        params.put("threshold", Z_THRESHOLD);
        return params;
    }

    @Override
    public ScoreResult score(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        List<Double> history = dp.getStockHistory();
        if (history == null || history.size() < WINDOW) {
            return ScoreResult.insufficientData("Insufficient stock history");
        }

        List<Double> recent = SeriesStatistics.trailing(history, WINDOW);
        double mean = SeriesStatistics.mean(recent);
        double stdDev = SeriesStatistics.stdDev(recent);
        double current = dp.getCurrentStock();
        double z = stdDev > 0 ? Math.abs((current - mean) / stdDev) : 0.0;

        if (z <= Z_THRESHOLD) {
            return ScoreResult.normal();
        }

        double confidence = Math.min(z / Z_THRESHOLD, 1.0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("zScore", z);
        details.put("mean", mean);
        details.put("stdDev", stdDev);
        details.put("currentValue", current);
        details.put("medicineName", dp.getMedicineName());
        details.put("medicineId", dp.getMedicineId());

        return ScoreResult.builder()
                .anomaly(true)
                .confidence(confidence)
                .type("Time Series Anomaly")
                .message(String.format("ML Anomaly: %s stock is %.2f SD from normal.", dp.getMedicineName(), z))
                .details(details)
                .causes(List.of("unexpected demand surge", "supply chain bottleneck",
                        "inventory miscount", "logistics delay"))
                .build();
    }
}

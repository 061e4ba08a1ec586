package com.medwatch.anomaly.engine.scoring;

import com.medwatch.anomaly.model.ContextualFeatures;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.NormalizedFeatures;
import com.medwatch.anomaly.model.ScoreResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outlier score over a 7-dimensional feature vector, each feature clamped to [0, 1]
 * where 0.5 is the typical value.
 *
 * Features:
 *   [0] Stock level: currentStock / maxCapacity
 *   [1] Relative price: (currentPrice / averageMarketPrice) / 2
 *   [2] Relative demand: (currentDemand / averageDemand) / 2
 *   [3] Restock age: daysSinceRestock / 60
 *   [4] Seasonal factor / 2
 *   [5] Location risk
 *   [6] Supplier reliability (0.5 when unknown)
 *
 * A feature without a baseline takes the neutral 0.5. Score = 2 * mean(|v - 0.5|), so a
 * vector at the extremes everywhere scores 1.0.
 */
@Component
public class IsolationScorer implements AnomalyScorer {

    static final int FEATURE_COUNT = 7;
    static final double THRESHOLD = 0.6;
    static final double RESTOCK_HORIZON_DAYS = 60.0;

    static final String[] FEATURE_NAMES = {
            "Stock Level",
            "Relative Price",
            "Relative Demand",
            "Restock Age",
            "Seasonal Factor",
            "Location Risk",
            "Supplier Reliability"
    };

    @Override
    public String getModelId() {
        return "isolation-forest";
    }

    @Override
    public String getCategory() {
        return "anomaly-detection";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("featureCount", FEATURE_COUNT);
        params.put("threshold", THRESHOLD);
        params.put("restockHorizonDays", RESTOCK_HORIZON_DAYS);
        return params;
    }

    @Override
    public ScoreResult score(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        double[] features = extract(enriched);
        double score = isolationScore(features);

        if (score <= THRESHOLD) {
            return ScoreResult.builder().anomaly(false).confidence(score).build();
        }

        Map<String, Object> featureMap = new LinkedHashMap<>();
        for (int i = 0; i < FEATURE_COUNT; i++) {
            featureMap.put(FEATURE_NAMES[i], features[i]);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("isolationScore", score);
        details.put("features", featureMap);
        details.put("medicineName", dp.getMedicineName());
        details.put("medicineId", dp.getMedicineId());

        return ScoreResult.builder()
                .anomaly(true)
                .confidence(score)
                .type("Isolation Forest Anomaly")
                .message(String.format("ML Anomaly: %s shows unusual behavior (Isolation Score: %.3f).",
                        dp.getMedicineName(), score))
                .details(details)
                .causes(List.of("data quality issue", "system error", "unforeseen event",
                        "unusual transaction volume"))
                .build();
    }

    static double[] extract(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        NormalizedFeatures normalized = enriched.getNormalized();
        ContextualFeatures contextual = enriched.getContextual();
        double[] features = new double[FEATURE_COUNT];

        features[0] = clampOrNeutral(normalized != null ? normalized.getStockLevel() : null, 1.0);
        features[1] = clampOrNeutral(normalized != null ? normalized.getRelativePrice() : null, 0.5);
        features[2] = clampOrNeutral(normalized != null ? normalized.getRelativeDemand() : null, 0.5);
        features[3] = clampOrNeutral(dp.getDaysSinceRestock(), 1.0 / RESTOCK_HORIZON_DAYS);
        features[4] = contextual != null ? clamp(contextual.getSeasonalFactor() / 2) : 0.5;
        features[5] = contextual != null ? clamp(contextual.getLocationRisk()) : 0.5;
        features[6] = clampOrNeutral(dp.getSupplierReliability(), 1.0);
        return features;
    }

    static double isolationScore(double[] features) {
        double sum = 0.0;
        for (double f : features) {
            sum += Math.abs(f - 0.5);
        }
        return Math.min(2 * sum / features.length, 1.0);
    }

    private static double clampOrNeutral(Double value, double scale) {
        if (value == null || !Double.isFinite(value)) return 0.5;
        return clamp(value * scale);
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}

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
 * Scores price instability: the larger of twice the mean step-to-step relative change over
 * the last 5 prices and the deviation from the market average.
 */
@Component
public class PriceScorer implements AnomalyScorer {

    static final int MIN_HISTORY = 3;
    static final int WINDOW = 5;
    static final double THRESHOLD = 0.3;

    @Override
    public String getModelId() {
        return "price-anomaly";
    }

    @Override
    public String getCategory() {
        return "price-analysis";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("windowSize", WINDOW);
        params.put("priceChangeThreshold", THRESHOLD);
        return params;
    }

    @Override
    public ScoreResult score(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        List<Double> history = dp.getPriceHistory();
        if (history == null || history.size() < MIN_HISTORY || dp.getCurrentPrice() == null) {
            return ScoreResult.insufficientData("Insufficient price history");
        }

        double volatility = averageRelativeChange(SeriesStatistics.trailing(history, WINDOW));
        double price = dp.getCurrentPrice();
        Double market = dp.getAverageMarketPrice();
        double marketDeviation = market != null && market > 0 ? Math.abs(price - market) / market : 0.0;
        double score = Math.max(volatility * 2, marketDeviation);

        if (score <= THRESHOLD) {
            return ScoreResult.builder().anomaly(false).confidence(score).build();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentPrice", price);
        details.put("avgVolatility", volatility);
        details.put("marketDeviation", marketDeviation);
        details.put("anomalyScore", score);
        details.put("averageMarketPrice", market);
        details.put("medicineName", dp.getMedicineName());
        details.put("medicineId", dp.getMedicineId());

        return ScoreResult.builder()
                .anomaly(true)
                .confidence(Math.min(score, 1.0))
                .type("Price Anomaly")
                .message(String.format("ML Anomaly: %s price anomaly detected (Score: %.3f).",
                        dp.getMedicineName(), score))
                .details(details)
                .causes(List.of("price volatility", "market deviation", "raw material cost increase",
                        "import restrictions"))
                .build();
    }

    static double averageRelativeChange(List<Double> prices) {
        if (prices.size() < 2) return 0.0;
        double sum = 0.0;
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            sum += previous > 0 ? Math.abs(prices.get(i) - previous) / previous : 0.0;
        }
        return sum / (prices.size() - 1);
    }
}

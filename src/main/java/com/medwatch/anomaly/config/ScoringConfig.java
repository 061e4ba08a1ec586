package com.medwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "medwatch.scoring")
public class ScoringConfig {

    /** Combination weight per model id. */
    private Map<String, Double> weights = defaultWeights();

    /** Weight of any model without an entry in {@link #weights}. */
    private double defaultWeight = 0.1;

    /** Combined confidence above which a data point is anomalous. */
    private double anomalyThreshold = 0.5;

    /** Confidence above which a single model's call counts as a detection in its stats. */
    private double detectionThreshold = 0.5;

    public double weightFor(String modelId) {
        Double weight = weights.get(modelId);
        return weight != null ? weight : defaultWeight;
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("time-series-anomaly", 0.3);
        weights.put("isolation-forest", 0.3);
        weights.put("price-anomaly", 0.2);
        weights.put("demand-forecast", 0.2);
        return weights;
    }
}

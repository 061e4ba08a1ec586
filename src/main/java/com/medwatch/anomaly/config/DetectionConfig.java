package com.medwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "medwatch.detection")
public class DetectionConfig {

    /** Fixed delay between batch cycles. */
    private Duration processingInterval = Duration.ofSeconds(30);

    /** Minimum anomaly confidence forwarded to the alert manager. */
    private double alertThreshold = 0.7;

    /** Maximum data points taken from each source per cycle. */
    private int batchSize = 1000;

    private boolean ruleEngineEnabled = true;
    private boolean scoringEnabled = true;

    /** Start the batch cycle when the application starts. */
    private boolean autoStart = true;

    /** Worker pool size for per-data-point processing. 0 means available processors. */
    private int workerThreads = 0;

    /** Zone used to derive temporal features from timestamps without an offset. */
    private String zoneId = "UTC";

    /** Anomalies kept in memory for querying and review. Oldest are evicted first. */
    private int historyLimit = 10000;

    /** Read pending data points from the Aerospike medicine_data set. */
    private boolean storeSourceEnabled = true;

    private FeatureThresholds features = new FeatureThresholds();

    @Data
    public static class FeatureThresholds {
        private double priceDeviationThreshold = 0.2;
        private double deliveryOverdueFactor = 1.5;
        private double defaultDeliveryIntervalDays = 7;
        private int nearExpiryDays = 30;
        private int trendWindow = 7;
        private int minHistoryForWarning = 7;
        private double highDemandSeasonFactor = 1.2;
    }
}

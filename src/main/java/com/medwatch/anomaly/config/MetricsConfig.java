package com.medwatch.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger alertQueueDepth;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.alertQueueDepth = registry.gauge("alert.queue.depth", new AtomicInteger(0));
    }

    public void recordBatch(int dataPoints, int anomalies) {
        DistributionSummary.builder("detection.batch.size")
                .register(registry)
                .record(dataPoints);

        Counter.builder("detection.batch.count")
                .tag("outcome", anomalies > 0 ? "anomalous" : "clean")
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String method, String severity, double confidence) {
        Counter.builder("anomaly.detected.count")
                .tag("method", method)
                .tag("severity", severity)
                .register(registry)
                .increment();

        DistributionSummary.builder("anomaly.confidence")
                .tag("method", method)
                .register(registry)
                .record(confidence);
    }

    public void recordInvalidDataPoint() {
        Counter.builder("datapoint.invalid.count")
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String category) {
        Counter.builder("rule.triggered.count")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordModelDetection(String modelId) {
        Counter.builder("model.detection.count")
                .tag("model", modelId)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAlertTransition(String status) {
        Counter.builder("alert.status.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateAlertQueueDepth(int depth) {
        alertQueueDepth.set(depth);
    }
}

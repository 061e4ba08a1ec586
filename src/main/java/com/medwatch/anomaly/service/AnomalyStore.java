package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.Anomaly;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of detected anomalies.
 */
public interface AnomalyStore {

    void save(Anomaly anomaly);

    void updateStatus(Anomaly anomaly);

    Optional<Anomaly> findById(String anomalyId);

    /**
     * Most recent anomalies first.
     */
    List<Anomaly> list(int limit);
}

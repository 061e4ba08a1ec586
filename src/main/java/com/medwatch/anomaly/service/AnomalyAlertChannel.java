package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.Anomaly;

import java.util.Optional;

/**
 * Receives anomalies confident enough to alert on.
 */
public interface AnomalyAlertChannel {

    /**
     * @return the id of the created alert, or empty when no alert policy applies
     */
    Optional<String> sendAlert(Anomaly anomaly);
}

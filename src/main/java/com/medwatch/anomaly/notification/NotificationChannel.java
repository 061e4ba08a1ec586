package com.medwatch.anomaly.notification;

import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.NotificationResult;

import java.util.List;

/**
 * An outbound delivery channel (email, sms, slack, webhook).
 */
public interface NotificationChannel {

    /**
     * Channel name as used in alert rules.
     */
    String getName();

    boolean isEnabled();

    /**
     * Deliver the alert to the given recipients.
     *
     * @param escalation true when delivering an escalation of an unacknowledged alert
     * @throws com.medwatch.anomaly.exception.DeliveryException if the channel cannot deliver at all
     */
    NotificationResult send(Alert alert, List<String> recipients, boolean escalation);
}

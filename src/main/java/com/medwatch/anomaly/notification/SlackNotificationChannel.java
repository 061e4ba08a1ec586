package com.medwatch.anomaly.notification;

import com.medwatch.anomaly.config.NotificationConfig;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.NotificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Slack delivery. The attachment payload is built and logged.
 */
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SlackNotificationChannel.class);

    private final NotificationConfig.Slack config;
    private final AlertMessageFormatter formatter;
    private final Clock clock;

    public SlackNotificationChannel(NotificationConfig notificationConfig, AlertMessageFormatter formatter, Clock clock) {
        this.config = notificationConfig.getSlack();
        this.formatter = formatter;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public NotificationResult send(Alert alert, List<String> recipients, boolean escalation) {
        Map<String, Object> payload = formatter.slackPayload(alert);
        log.info("Sending Slack alert to={} text=\"{}\"", recipients, payload.get("text"));

        return NotificationResult.builder()
                .channel(getName())
                .success(true)
                .messageId("slack-" + UUID.randomUUID())
                .recipients(new ArrayList<>(recipients))
                .escalation(escalation)
                .sentAt(clock.millis())
                .build();
    }
}

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
import java.util.UUID;

/**
 * Email delivery. Messages are rendered and logged; no mail transport is wired.
 */
@Component
public class EmailNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

    private final NotificationConfig.Email config;
    private final AlertMessageFormatter formatter;
    private final Clock clock;

    public EmailNotificationChannel(NotificationConfig notificationConfig, AlertMessageFormatter formatter, Clock clock) {
        this.config = notificationConfig.getEmail();
        this.formatter = formatter;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public NotificationResult send(Alert alert, List<String> recipients, boolean escalation) {
        String subject = formatter.subject(alert, escalation);
        log.info("Sending email alert from={} to={} subject=\"{}\"", config.getFrom(), recipients, subject);
        log.debug("Email body for {}:\n{}", alert.getId(), formatter.emailBody(alert));

        return NotificationResult.builder()
                .channel(getName())
                .success(true)
                .messageId("email-" + UUID.randomUUID())
                .recipients(new ArrayList<>(recipients))
                .escalation(escalation)
                .sentAt(clock.millis())
                .build();
    }
}

package com.medwatch.anomaly.notification;

import com.medwatch.anomaly.config.NotificationConfig;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.NotificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * POSTs a JSON alert payload to each endpoint. Endpoints come from the alert rule's webhook
 * recipients, or from {@code medwatch.notifications.webhook.endpoints} when the rule lists none.
 * With no endpoints at all the payload is only logged.
 */
@Component
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final NotificationConfig.Webhook config;
    private final AlertMessageFormatter formatter;
    private final RestTemplate restTemplate;
    private final Clock clock;

    @Autowired
    public WebhookNotificationChannel(NotificationConfig notificationConfig, AlertMessageFormatter formatter, Clock clock) {
        this(notificationConfig, formatter, clock, buildRestTemplate(notificationConfig.getWebhook().getTimeoutMs()));
    }

    WebhookNotificationChannel(NotificationConfig notificationConfig, AlertMessageFormatter formatter,
                               Clock clock, RestTemplate restTemplate) {
        this.config = notificationConfig.getWebhook();
        this.formatter = formatter;
        this.clock = clock;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public NotificationResult send(Alert alert, List<String> recipients, boolean escalation) {
        List<String> endpoints = recipients.isEmpty() ? config.getEndpoints() : recipients;
        Map<String, Object> payload = formatter.webhookPayload(alert, escalation);

        if (endpoints.isEmpty()) {
            log.info("No webhook endpoints configured, alert {} payload: {}", alert.getId(), payload);
            return result(true, List.of(), null, escalation);
        }

        List<String> delivered = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (String endpoint : endpoints) {
            try {
                ResponseEntity<String> response = restTemplate.postForEntity(endpoint, payload, String.class);
                delivered.add(endpoint);
                log.info("Delivered alert {} to webhook {} (status={})",
                        alert.getId(), endpoint, response.getStatusCode().value());
            } catch (RestClientException e) {
                errors.add(endpoint + ": " + e.getMessage());
                log.error("Webhook delivery of alert {} to {} failed: {}", alert.getId(), endpoint, e.getMessage(), e);
            }
        }
        return result(!delivered.isEmpty(), delivered, errors.isEmpty() ? null : String.join("; ", errors), escalation);
    }

    private NotificationResult result(boolean success, List<String> delivered, String error, boolean escalation) {
        return NotificationResult.builder()
                .channel(getName())
                .success(success)
                .recipients(new ArrayList<>(delivered))
                .error(error)
                .escalation(escalation)
                .sentAt(clock.millis())
                .build();
    }
}

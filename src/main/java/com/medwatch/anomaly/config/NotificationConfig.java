package com.medwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "medwatch.notifications")
public class NotificationConfig {

    private Email email = new Email();
    private Slack slack = new Slack();
    private Webhook webhook = new Webhook();

    @Data
    public static class Email {
        private boolean enabled = true;
        private String from = "alerts@medwatch.local";
    }

    @Data
    public static class Slack {
        private boolean enabled = true;
    }

    @Data
    public static class Webhook {
        private boolean enabled = true;
        /** Endpoints to POST alerts to. Deliveries are logged only when empty. */
        private List<String> endpoints = new ArrayList<>();
        private int timeoutMs = 5000;
    }
}

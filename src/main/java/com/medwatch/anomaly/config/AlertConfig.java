package com.medwatch.anomaly.config;

import com.medwatch.anomaly.model.AlertRule;
import com.medwatch.anomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alert delivery policy. The rule table is read once by the alert manager at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "medwatch.alerts")
public class AlertConfig {

    private int maxAttempts = 3;

    /** Retry delay multiplied by the attempt count. */
    private Duration retryDelay = Duration.ofMillis(5000);

    /** Delay between the first enqueue and draining the alert queue. */
    private Duration queueDebounce = Duration.ofSeconds(1);

    /** Size of the channel fan-out pool. */
    private int notificationThreads = 8;

    private Map<Severity, AlertRule> rules = defaultRules();

    public static Map<Severity, AlertRule> defaultRules() {
        Map<Severity, AlertRule> rules = new EnumMap<>(Severity.class);

        rules.put(Severity.CRITICAL, AlertRule.builder()
                .channels(new ArrayList<>(List.of("email", "sms", "slack")))
                .immediate(true)
                .escalation(escalation(Duration.ofMinutes(15), "sms", "webhook"))
                .recipients(recipients(
                        "email", List.of("admin@medwatch.com", "emergency@medwatch.com"),
                        "sms", List.of("+1234567890"),
                        "slack", List.of("#critical-alerts")))
                .build());

        rules.put(Severity.HIGH, AlertRule.builder()
                .channels(new ArrayList<>(List.of("email", "slack")))
                .immediate(true)
                .escalation(escalation(Duration.ofMinutes(30), "sms"))
                .recipients(recipients(
                        "email", List.of("admin@medwatch.com"),
                        "sms", List.of("+1234567890"),
                        "slack", List.of("#alerts")))
                .build());

        rules.put(Severity.MEDIUM, AlertRule.builder()
                .channels(new ArrayList<>(List.of("email")))
                .immediate(false)
                .batchingEnabled(true)
                .batchingInterval(Duration.ofMinutes(15))
                .recipients(recipients("email", List.of("alerts@medwatch.com")))
                .build());

        rules.put(Severity.LOW, AlertRule.builder()
                .channels(new ArrayList<>(List.of("email")))
                .immediate(false)
                .batchingEnabled(true)
                .batchingInterval(Duration.ofMinutes(60))
                .recipients(recipients("email", List.of("reports@medwatch.com")))
                .build());

        return rules;
    }

    private static AlertRule.Escalation escalation(Duration timeout, String... channels) {
        return AlertRule.Escalation.builder()
                .enabled(true)
                .timeout(timeout)
                .escalateToChannels(new ArrayList<>(List.of(channels)))
                .build();
    }

    private static Map<String, List<String>> recipients(Object... pairs) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) pairs[i + 1];
            map.put((String) pairs[i], new ArrayList<>(list));
        }
        return map;
    }
}

package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AlertConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.config.TwilioNotificationConfig;
import com.medwatch.anomaly.exception.AlertNotFoundException;
import com.medwatch.anomaly.exception.DeliveryException;
import com.medwatch.anomaly.model.*;
import com.medwatch.anomaly.notification.AlertMessageFormatter;
import com.medwatch.anomaly.notification.NotificationChannel;
import com.medwatch.anomaly.notification.SmsNotificationChannel;
import com.medwatch.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertManagerTest {

    private AlertConfig config;
    private FakeChannel email;
    private FakeChannel sms;
    private FakeChannel slack;
    private FakeChannel webhook;
    private AlertManager manager;

    @BeforeEach
    void setUp() {
        config = new AlertConfig();
        // Keep background retries and queue draining out of the way; tests drive them directly
        config.setRetryDelay(Duration.ofHours(1));
        config.setQueueDebounce(Duration.ofHours(1));
        config.setNotificationThreads(2);
        email = new FakeChannel("email");
        sms = new FakeChannel("sms");
        slack = new FakeChannel("slack");
        webhook = new FakeChannel("webhook");
        manager = new AlertManager(List.of(email, sms, slack, webhook), config,
                TestDataFactory.metrics(), TestDataFactory.fixedClock());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static Anomaly anomaly(String id, Severity severity, double confidence) {
        return TestDataFactory.createAnomaly(id, severity, confidence);
    }

    @Test
    void criticalAlert_isDeliveredImmediatelyAndEscalationScheduled() {
        String alertId = manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();

        Alert alert = manager.getAlert(alertId);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(alert.getAttempts()).isEqualTo(1);
        assertThat(alert.getNotifications()).extracting(NotificationResult::getChannel)
                .containsExactly("email", "sms", "slack");
        assertThat(email.recipients).containsExactly(List.of("admin@medwatch.com", "emergency@medwatch.com"));
        assertThat(webhook.recipients).isEmpty();
        assertThat(manager.hasScheduledEscalation(alertId)).isTrue();
        assertThat(manager.getQueueSize()).isZero();
    }

    @Test
    void missingSeverity_isDerivedFromConfidence() {
        Anomaly anomaly = anomaly("A-1", null, 0.75);

        String alertId = manager.sendAlert(anomaly).orElseThrow();

        Alert alert = manager.getAlert(alertId);
        assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.getNotifications()).extracting(NotificationResult::getChannel)
                .containsExactly("email", "slack");
    }

    @ParameterizedTest
    @CsvSource({
            "0.95, CRITICAL",
            "0.9, CRITICAL",
            "0.8999, HIGH",
            "0.75, HIGH",
            "0.7, HIGH",
            "0.55, MEDIUM",
            "0.5, MEDIUM",
            "0.4999, LOW",
            "0.3, LOW"
    })
    void confidenceBands_haveInclusiveLowerBounds(double confidence, Severity expected) {
        assertThat(Severity.fromConfidence(confidence)).isEqualTo(expected);

        String alertId = manager.sendAlert(anomaly("A-1", null, confidence)).orElseThrow();

        assertThat(manager.getAlert(alertId).getSeverity()).isEqualTo(expected);
    }

    @Test
    void smsDelivery_isCountedOncePerSend() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TwilioNotificationConfig twilio = new TwilioNotificationConfig();
        twilio.setEnabled(true);
        twilio.setFromNumber("+10000000000");
        SmsNotificationChannel realSms = new SmsNotificationChannel(twilio, new AlertMessageFormatter(),
                TestDataFactory.fixedClock());
        config.getRules().get(Severity.CRITICAL).getRecipients().put("sms", List.of("not-a-number"));
        manager.shutdown();
        manager = new AlertManager(List.of(email, realSms, slack, webhook), config,
                new MetricsConfig(registry), TestDataFactory.fixedClock());

        manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();

        assertThat(registry.get("notification.sent.count").tag("channel", "sms").counters())
                .hasSize(1)
                .allSatisfy(counter -> assertThat(counter.count()).isEqualTo(1.0));
    }

    @Test
    void explicitSeverity_winsOverConfidence() {
        String alertId = manager.sendAlert(anomaly("A-1", Severity.LOW, 0.95)).orElseThrow();

        Alert alert = manager.getAlert(alertId);
        assertThat(alert.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.PENDING);
        assertThat(manager.getQueueSize()).isEqualTo(1);
        assertThat(email.recipients).isEmpty();
    }

    @Test
    void severityWithoutRule_isNotAlerted() {
        config.getRules().remove(Severity.LOW);

        Optional<String> alertId = manager.sendAlert(anomaly("A-1", Severity.LOW, 0.3));

        assertThat(alertId).isEmpty();
        assertThat(manager.getRecentAlerts(10)).isEmpty();
    }

    @Test
    void allChannelsFailing_retriesUntilMaxAttempts() {
        email.mode = Mode.FAIL;
        slack.mode = Mode.THROW;

        String alertId = manager.sendAlert(anomaly("A-1", Severity.HIGH, 0.8)).orElseThrow();
        Alert alert = manager.getAlert(alertId);

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FAILED);
        assertThat(alert.getError()).isEqualTo("All channels failed");
        assertThat(alert.getAttempts()).isEqualTo(1);
        assertThat(manager.hasScheduledRetry(alertId)).isTrue();

        manager.processAlert(alert);
        manager.processAlert(alert);

        assertThat(alert.getAttempts()).isEqualTo(3);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FAILED);
        assertThat(manager.hasScheduledRetry(alertId)).isFalse();
        assertThat(alert.getNotifications()).hasSize(6)
                .allSatisfy(result -> assertThat(result.isSuccess()).isFalse());
    }

    @Test
    void oneChannelSucceeding_isEnough() {
        sms.mode = Mode.THROW;

        String alertId = manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();

        Alert alert = manager.getAlert(alertId);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(alert.getNotifications()).filteredOn(r -> !r.isSuccess())
                .extracting(NotificationResult::getChannel).containsExactly("sms");
    }

    @Test
    void noEnabledChannel_failsWithReason() {
        email.enabled = false;
        slack.enabled = false;

        String alertId = manager.sendAlert(anomaly("A-1", Severity.HIGH, 0.8)).orElseThrow();

        Alert alert = manager.getAlert(alertId);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FAILED);
        assertThat(alert.getError()).isEqualTo("No enabled channel");
        assertThat(alert.getNotifications()).isEmpty();
    }

    @Test
    void escalate_deliversToEscalationChannels() {
        String alertId = manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();
        Alert alert = manager.getAlert(alertId);

        manager.escalate(alert);

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ESCALATED);
        assertThat(alert.getEscalatedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(alert.getNotifications()).filteredOn(NotificationResult::isEscalation)
                .extracting(NotificationResult::getChannel).containsExactly("sms", "webhook");
        assertThat(webhook.escalations).containsExactly(true);
    }

    @Test
    void acknowledge_cancelsEscalation() {
        String alertId = manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();

        Alert alert = manager.acknowledgeAlert(alertId, "oncall");

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.getAcknowledgedBy()).isEqualTo("oncall");
        assertThat(alert.getAcknowledgedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(manager.hasScheduledEscalation(alertId)).isFalse();

        manager.escalate(alert);
        manager.processAlert(alert);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.getAttempts()).isEqualTo(1);
    }

    @Test
    void acknowledge_cancelsRetry() {
        email.mode = Mode.FAIL;
        slack.mode = Mode.FAIL;
        String alertId = manager.sendAlert(anomaly("A-1", Severity.HIGH, 0.8)).orElseThrow();
        assertThat(manager.hasScheduledRetry(alertId)).isTrue();

        manager.acknowledgeAlert(alertId, "ops");

        assertThat(manager.hasScheduledRetry(alertId)).isFalse();
    }

    @Test
    void acknowledge_unknownAlert_throwsNotFound() {
        assertThatThrownBy(() -> manager.acknowledgeAlert("ALERT-MISSING", "ops"))
                .isInstanceOf(AlertNotFoundException.class);
        assertThatThrownBy(() -> manager.getAlert("ALERT-MISSING"))
                .isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    void drainQueue_batchesSameSeverity() {
        String first = manager.sendAlert(anomaly("A-1", Severity.MEDIUM, 0.6)).orElseThrow();
        String second = manager.sendAlert(anomaly("A-2", Severity.MEDIUM, 0.55)).orElseThrow();
        String low = manager.sendAlert(anomaly("A-3", Severity.LOW, 0.3)).orElseThrow();
        assertThat(manager.getQueueSize()).isEqualTo(3);

        manager.drainQueue();

        assertThat(manager.getQueueSize()).isZero();
        Alert batch = manager.getRecentAlerts(1).get(0);
        assertThat(batch.isBatch()).isTrue();
        assertThat(batch.getId()).startsWith("BATCH-");
        assertThat(batch.getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(batch.getBatchMembers()).extracting(Anomaly::getId).containsExactly("A-1", "A-2");

        assertThat(manager.getAlert(first).getBatchId()).isEqualTo(batch.getId());
        assertThat(manager.getAlert(second).getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(manager.getAlert(low).getBatchId()).isNull();
        assertThat(manager.getAlert(low).getStatus()).isEqualTo(AlertStatus.SENT);
        assertThat(email.recipients).containsExactlyInAnyOrder(
                List.of("reports@medwatch.com"), List.of("alerts@medwatch.com"));
    }

    @Test
    void getRecentAlerts_newestFirstWithLimit() {
        String first = manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0)).orElseThrow();
        String second = manager.sendAlert(anomaly("A-2", Severity.HIGH, 0.8)).orElseThrow();

        assertThat(manager.getRecentAlerts(10)).extracting(Alert::getId).containsExactly(second, first);
        assertThat(manager.getRecentAlerts(1)).extracting(Alert::getId).containsExactly(second);
    }

    @Test
    void getAlertStats_countsBySeverityAndStatus() {
        manager.sendAlert(anomaly("A-1", Severity.CRITICAL, 1.0));
        manager.sendAlert(anomaly("A-2", Severity.HIGH, 0.8));
        manager.sendAlert(anomaly("A-3", Severity.LOW, 0.3));

        AlertStatistics stats = manager.getAlertStats();

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getLast24Hours()).isEqualTo(3);
        assertThat(stats.getBySeverity()).isEqualTo(Map.of("critical", 1L, "high", 1L, "low", 1L));
        assertThat(stats.getByStatus()).isEqualTo(Map.of("sent", 2L, "pending", 1L));
        assertThat(stats.getAverageResponseTimeMs()).isZero();
        assertThat(stats.getQueueSize()).isEqualTo(1);
    }

    private enum Mode { SUCCEED, FAIL, THROW }

    private static final class FakeChannel implements NotificationChannel {
        private final String name;
        private volatile boolean enabled = true;
        private volatile Mode mode = Mode.SUCCEED;
        private final List<List<String>> recipients = new CopyOnWriteArrayList<>();
        private final List<Boolean> escalations = new CopyOnWriteArrayList<>();

        FakeChannel(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public NotificationResult send(Alert alert, List<String> to, boolean escalation) {
            recipients.add(to);
            escalations.add(escalation);
            switch (mode) {
                case FAIL:
                    return NotificationResult.failure(name, "rejected");
                case THROW:
                    throw new DeliveryException(name, "unreachable");
                default:
                    return NotificationResult.builder()
                            .channel(name)
                            .success(true)
                            .messageId(name + "-" + alert.getId())
                            .recipients(to)
                            .escalation(escalation)
                            .build();
            }
        }
    }
}

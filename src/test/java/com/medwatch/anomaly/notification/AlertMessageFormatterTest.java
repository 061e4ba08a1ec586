package com.medwatch.anomaly.notification;

import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.AlertStatus;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertMessageFormatterTest {

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    private final Alert single = TestDataFactory.createAlert("ALERT-1", Severity.CRITICAL, AlertStatus.PROCESSING);

    private Alert batch() {
        return Alert.builder()
                .id("BATCH-1")
                .batch(true)
                .batchMembers(List.of(
                        TestDataFactory.createAnomaly("A-1", Severity.MEDIUM, 0.6),
                        TestDataFactory.createAnomaly("A-2", Severity.MEDIUM, 0.55)))
                .severity(Severity.MEDIUM)
                .createdAt(TestDataFactory.NOW.toEpochMilli())
                .build();
    }

    @Test
    void subject_marksEscalationAndBatchSize() {
        assertThat(formatter.subject(single, false)).isEqualTo("[CRITICAL] Medicine Shortage Alert");
        assertThat(formatter.subject(single, true)).isEqualTo("[ESCALATION] [CRITICAL] Medicine Shortage Alert");
        assertThat(formatter.subject(batch(), false)).isEqualTo("[MEDIUM] 2 Medicine Supply Anomalies");
    }

    @Test
    void smsText_summarizesAnomaly() {
        assertThat(formatter.smsText(single))
                .isEqualTo("[CRITICAL] Insulin shortage in Delhi. Confidence: 100%. Alert ID: ALERT-1");
        assertThat(formatter.smsText(batch()))
                .isEqualTo("[MEDIUM] 2 medicine supply anomalies detected. Alert ID: BATCH-1");
    }

    @Test
    void emailBody_listsDetailsOrBatchMembers() {
        assertThat(formatter.emailBody(single))
                .contains("Alert ID: ALERT-1")
                .contains("- Medicine: Insulin")
                .contains("- Confidence: 100.0%");
        assertThat(formatter.emailBody(batch()))
                .contains("2 anomalies:")
                .contains("- Insulin at Delhi: STOCKOUT: Insulin is completely out of stock at Delhi (60%)");
    }

    @Test
    @SuppressWarnings("unchecked")
    void slackPayload_colorsBySeverity() {
        Map<String, Object> payload = formatter.slackPayload(single);

        assertThat(payload).containsEntry("text", "[CRITICAL] Medicine Shortage Alert");
        Map<String, Object> attachment = ((List<Map<String, Object>>) payload.get("attachments")).get(0);
        assertThat(attachment).containsEntry("color", "danger")
                .containsEntry("ts", TestDataFactory.NOW.getEpochSecond());
    }

    @Test
    @SuppressWarnings("unchecked")
    void webhookPayload_carriesEveryBatchMember() {
        Map<String, Object> payload = formatter.webhookPayload(batch(), true);

        assertThat(payload).containsEntry("alertId", "BATCH-1")
                .containsEntry("severity", "medium")
                .containsEntry("escalation", true)
                .containsEntry("timestamp", "2026-01-15T10:00:00Z");
        assertThat((List<Map<String, Object>>) payload.get("anomalies"))
                .extracting(m -> m.get("id")).containsExactly("A-1", "A-2");
    }
}

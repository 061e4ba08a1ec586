package com.medwatch.anomaly.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders alerts into channel-specific message bodies.
 */
@Component
public class AlertMessageFormatter {

    private static final Logger log = LoggerFactory.getLogger(AlertMessageFormatter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String subject(Alert alert, boolean escalation) {
        String prefix = escalation ? "[ESCALATION] " : "";
        if (alert.isBatch()) {
            return String.format("%s[%s] %d Medicine Supply Anomalies", prefix,
                    severity(alert), alert.getBatchMembers().size());
        }
        return String.format("%s[%s] Medicine Shortage Alert", prefix, severity(alert));
    }

    public String emailBody(Alert alert) {
        StringBuilder sb = new StringBuilder();
        sb.append("Alert ID: ").append(alert.getId()).append('\n');
        sb.append("Severity: ").append(severity(alert)).append('\n');
        sb.append("Time: ").append(Instant.ofEpochMilli(alert.getCreatedAt())).append('\n');

        if (alert.isBatch()) {
            sb.append('\n').append(alert.getBatchMembers().size()).append(" anomalies:\n");
            for (Anomaly member : alert.getBatchMembers()) {
                sb.append("- ").append(summary(member)).append('\n');
            }
            return sb.toString();
        }

        Anomaly anomaly = alert.getAnomaly();
        sb.append("\nAnomaly Details:\n");
        sb.append("- Type: ").append(anomaly.getType()).append('\n');
        sb.append("- Medicine: ").append(anomaly.getMedicineName()).append('\n');
        sb.append("- Location: ").append(anomaly.getLocation()).append('\n');
        sb.append("- Confidence: ").append(String.format("%.1f%%", anomaly.getConfidence() * 100)).append('\n');
        sb.append("- Message: ").append(anomaly.getMessage()).append('\n');
        sb.append("\nAdditional Details:\n").append(toJson(anomaly.getDetails()));
        return sb.toString();
    }

    public String smsText(Alert alert) {
        if (alert.isBatch()) {
            return String.format("[%s] %d medicine supply anomalies detected. Alert ID: %s",
                    severity(alert), alert.getBatchMembers().size(), alert.getId());
        }
        Anomaly anomaly = alert.getAnomaly();
        return String.format("[%s] %s shortage in %s. Confidence: %.0f%%. Alert ID: %s",
                severity(alert), anomaly.getMedicineName(), anomaly.getLocation(),
                anomaly.getConfidence() * 100, alert.getId());
    }

    public Map<String, Object> slackPayload(Alert alert) {
        List<Map<String, Object>> fields = new ArrayList<>();
        if (alert.isBatch()) {
            fields.add(field("Anomalies", String.valueOf(alert.getBatchMembers().size())));
        } else {
            Anomaly anomaly = alert.getAnomaly();
            fields.add(field("Medicine", anomaly.getMedicineName()));
            fields.add(field("Location", anomaly.getLocation()));
            fields.add(field("Confidence", String.format("%.1f%%", anomaly.getConfidence() * 100)));
        }
        fields.add(field("Alert ID", alert.getId()));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(alert.getSeverity()));
        attachment.put("fields", fields);
        attachment.put("footer", "MedWatch Anomaly Detection");
        attachment.put("ts", alert.getCreatedAt() / 1000);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", subject(alert, false));
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    public Map<String, Object> webhookPayload(Alert alert, boolean escalation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("severity", alert.getSeverity() != null ? alert.getSeverity().label() : null);
        payload.put("escalation", escalation);
        payload.put("timestamp", Instant.ofEpochMilli(alert.getCreatedAt()).toString());

        List<Map<String, Object>> anomalies = new ArrayList<>();
        if (alert.isBatch()) {
            for (Anomaly member : alert.getBatchMembers()) {
                anomalies.add(anomalyPayload(member));
            }
        } else if (alert.getAnomaly() != null) {
            anomalies.add(anomalyPayload(alert.getAnomaly()));
        }
        payload.put("anomalies", anomalies);
        return payload;
    }

    private Map<String, Object> anomalyPayload(Anomaly anomaly) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", anomaly.getId());
        map.put("type", anomaly.getType());
        map.put("medicine", anomaly.getMedicineName());
        map.put("location", anomaly.getLocation());
        map.put("confidence", anomaly.getConfidence());
        map.put("message", anomaly.getMessage());
        map.put("details", anomaly.getDetails());
        return map;
    }

    private static String summary(Anomaly anomaly) {
        return String.format("%s at %s: %s (%.0f%%)", anomaly.getMedicineName(), anomaly.getLocation(),
                anomaly.getMessage(), anomaly.getConfidence() * 100);
    }

    private static Map<String, Object> field(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }

    private static String severity(Alert alert) {
        return alert.getSeverity() != null ? alert.getSeverity().name() : "UNKNOWN";
    }

    private static String color(Severity severity) {
        if (severity == null) return "good";
        switch (severity) {
            case CRITICAL: return "danger";
            case HIGH: return "warning";
            case MEDIUM: return "good";
            default: return "#439FE0";
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert details", e);
            return "{}";
        }
    }
}

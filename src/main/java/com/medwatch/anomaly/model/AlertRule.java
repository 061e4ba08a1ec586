package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivery policy for alerts of one severity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    @Builder.Default
    private List<String> channels = new ArrayList<>();

    private boolean immediate;

    private boolean batchingEnabled;

    private Duration batchingInterval;

    @Builder.Default
    private Escalation escalation = new Escalation();

    /** Recipients keyed by channel name. */
    @Builder.Default
    private Map<String, List<String>> recipients = new LinkedHashMap<>();

    public List<String> recipientsFor(String channel) {
        List<String> list = recipients.get(channel);
        return list != null ? list : List.of();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Escalation {
        private boolean enabled;
        private Duration timeout;

        @Builder.Default
        private List<String> escalateToChannels = new ArrayList<>();
    }
}

package com.medwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResult {

    private String channel;
    private boolean success;
    private String messageId;
    private String error;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private boolean escalation;
    private long sentAt;

    public static NotificationResult failure(String channel, String error) {
        return NotificationResult.builder()
                .channel(channel)
                .success(false)
                .error(error)
                .sentAt(System.currentTimeMillis())
                .build();
    }
}

package com.medwatch.anomaly.exception;

import lombok.Getter;

@Getter
public class DeliveryException extends MedWatchException {

    private final String channel;

    public DeliveryException(String channel, String message) {
        super("DELIVERY_FAILED", message);
        this.channel = channel;
    }

    public DeliveryException(String channel, String message, Throwable cause) {
        super("DELIVERY_FAILED", message, cause);
        this.channel = channel;
    }
}

package com.medwatch.anomaly.notification;

import com.medwatch.anomaly.config.TwilioNotificationConfig;
import com.medwatch.anomaly.exception.DeliveryException;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.NotificationResult;
import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * SMS or WhatsApp delivery through Twilio. Enabled only when Twilio credentials are configured.
 * Each recipient is sent separately; the delivery succeeds if any recipient was reached.
 */
@Component
public class SmsNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmsNotificationChannel.class);

    private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{1,14}$");
    static final int MAX_LENGTH = 1600;

    private final TwilioNotificationConfig config;
    private final AlertMessageFormatter formatter;
    private final Clock clock;

    public SmsNotificationChannel(TwilioNotificationConfig config, AlertMessageFormatter formatter, Clock clock) {
        this.config = config;
        this.formatter = formatter;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio SMS channel initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio SMS channel is DISABLED.");
        }
    }

    @Override
    public String getName() {
        return "sms";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    @Observed(name = "notification.sms", contextualName = "send-sms")
    public NotificationResult send(Alert alert, List<String> recipients, boolean escalation) {
        if (!config.isEnabled()) {
            throw new DeliveryException(getName(), "Twilio is not configured");
        }
        String body = formatter.smsText(alert);
        if (body.length() > MAX_LENGTH) {
            throw new DeliveryException(getName(), "Message too long: " + body.length() + " characters");
        }

        List<String> delivered = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        String lastSid = null;

        for (String recipient : recipients) {
            String number = recipient.replaceAll("\\s", "");
            if (!PHONE.matcher(number).matches()) {
                errors.add(recipient + ": invalid phone number format");
                log.warn("Skipping SMS to {} for alert {}: invalid phone number", recipient, alert.getId());
                continue;
            }
            try {
                Message message = Message.creator(
                        new PhoneNumber(resolveNumber(number)),
                        new PhoneNumber(resolveNumber(config.getFromNumber())),
                        body
                ).create();
                lastSid = message.getSid();
                delivered.add(recipient);
                log.info("SMS sent for alert={} to={}, sid={}", alert.getId(), recipient, message.getSid());
            } catch (ApiException e) {
                errors.add(recipient + ": " + describe(e));
                log.error("Failed to send SMS for alert={} to={}: {}", alert.getId(), recipient, describe(e), e);
            }
        }

        boolean success = !delivered.isEmpty();
        return NotificationResult.builder()
                .channel(getName())
                .success(success)
                .messageId(lastSid)
                .error(errors.isEmpty() ? null : String.join("; ", errors))
                .recipients(delivered)
                .escalation(escalation)
                .sentAt(clock.millis())
                .build();
    }

    static String describe(ApiException e) {
        Integer code = e.getCode();
        if (code == null) return e.getMessage();
        switch (code) {
            case 21211: return "Invalid phone number - not valid or not reachable";
            case 21408: return "Permission denied - no permission to send SMS to this number";
            case 21608: return "Unverified number on a trial account";
            case 21614: return "Invalid phone number format - include the country code";
            default: return e.getMessage();
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}

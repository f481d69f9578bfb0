package com.farm.anomaly.config;

import com.farm.anomaly.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Text-message alerts for forwarded soil readings. Off unless
 * {@code twilio.enabled} is set and the account credentials are present.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;

    private String accountSid;
    private String authToken;

    // Sender and farm-operator numbers, E.164
    private String fromNumber;
    private String toNumber;

    // sms | whatsapp
    private String channel = "sms";

    // Lowest overall reading severity that pages the operator
    private Severity minSeverity = Severity.CRITICAL;

    // First line of every message
    private String messagePrefix = "[SOIL ALERT]";

    // Most parameters listed in one message
    private int maxParametersInMessage = 5;

    public boolean isConfigured() {
        return enabled && hasText(accountSid) && hasText(authToken) && hasText(fromNumber) && hasText(toNumber);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

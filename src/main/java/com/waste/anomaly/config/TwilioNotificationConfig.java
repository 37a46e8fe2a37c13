package com.waste.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Outbound alert to the oversight contact when a submission is flagged.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    // Oversight duty phone
    private String oversightNumber;
    private String channel = "sms";  // "sms" or "whatsapp"

    // Alert only for |z| at or above this; records below it are still stored and shown on the dashboard
    private double minAbsZScore = 0.0;
}

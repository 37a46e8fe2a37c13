package com.waste.anomaly.service;

import com.waste.anomaly.config.MetricsConfig;
import com.waste.anomaly.config.TwilioNotificationConfig;
import com.waste.anomaly.model.AnomalyRecord;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    /**
     * Alert the oversight contact about a newly flagged submission. Runs off the request thread.
     */
    @Async
    public void notifyAnomaly(AnomalyRecord anomaly) {
        if (!config.isEnabled()) {
            return;
        }
        if (Math.abs(anomaly.getZScore()) < config.getMinAbsZScore()) {
            log.debug("Skipping alert for subject={}: |z|={} below alert floor {}",
                    anomaly.getSubjectId(), Math.abs(anomaly.getZScore()), config.getMinAbsZScore());
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getOversightNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(anomaly)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Anomaly notification sent for subject={}, submission={}, sid={}",
                    anomaly.getSubjectId(), anomaly.getSubmissionId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send anomaly notification for subject={}: {}",
                    anomaly.getSubjectId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(AnomalyRecord anomaly) {
        return String.format(Locale.ROOT,
                "[WASTE ANOMALY] Unusual submission flagged\n" +
                "Facility: %s\n" +
                "Submission: %s\n" +
                "Quantity: %.2f\n" +
                "30-day mean: %.2f (std-dev %.2f)\n" +
                "Z-score: %.3f",
                anomaly.getSubjectId(),
                anomaly.getSubmissionId(),
                anomaly.getQuantity(),
                anomaly.getMean(),
                anomaly.getStdDev(),
                anomaly.getZScore()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}

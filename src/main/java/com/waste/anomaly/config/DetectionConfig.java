package com.waste.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Civil time zone used for every day boundary and trailing window.
    private String timeZone = "Asia/Kolkata";

    // Fewer usable samples than this and the classifier never flags.
    private int minSamples = 5;

    // |z| at or above this value is anomalous (inclusive).
    private double zScoreThreshold = 2.5;

    // Trailing history window handed to the classifier.
    private int windowDays = 30;

    private Remote remote = new Remote();

    private Oversight oversight = new Oversight();

    private Archive archive = new Archive();

    @Data
    public static class Remote {
        // When false the classifier runs in-process behind the same contract.
        private boolean enabled = true;
        private String url = "http://localhost:8080/api/v1/detect";
        // Hard deadline for one detection call, connect + read + parse.
        private long timeoutMs = 5000;
        private long connectTimeoutMs = 2000;
    }

    @Data
    public static class Oversight {
        private String role = "OVERSIGHT";
        private String roleHeader = "X-User-Role";
        private int recentLimit = 10;
        private int highRiskWindowDays = 7;
        private int highRiskThreshold = 3;
    }

    @Data
    public static class Archive {
        private boolean enabled = true;
    }
}

package com.waste.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmission(String status) {
        Counter.builder("submission.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDetectionOutcome(String outcome) {
        Counter.builder("detection.outcome.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnomalyFlagged(double zScore) {
        Counter.builder("anomaly.flagged.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("anomaly.flagged.abs_z_score")
                .register(registry)
                .record(Math.abs(zScore));
    }

    public void recordAnomalyRecordSave(String status) {
        Counter.builder("anomaly.record.save.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReportArchive(String status) {
        Counter.builder("report.archive.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}

package com.waste.anomaly.service;

import com.waste.anomaly.config.MetricsConfig;
import com.waste.anomaly.model.AnomalyRecord;
import com.waste.anomaly.model.Submission;
import com.waste.anomaly.model.Verdict;
import com.waste.anomaly.repository.AnomalyRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Persists flagged verdicts as anomaly records. Failures are logged and reported as {@code false},
 * never thrown.
 */
@Service
public class AnomalyRecordService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecordService.class);

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final ReportArchiveService reportArchiveService;
    private final TwilioNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyRecordService(AnomalyRecordRepository anomalyRecordRepository,
                                ReportArchiveService reportArchiveService,
                                TwilioNotificationService notificationService,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.reportArchiveService = reportArchiveService;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @return true if a record was stored
     */
    public boolean persist(Submission submission, Verdict verdict) {
        if (verdict == null || !verdict.anomaly()) {
            log.debug("Refusing to record non-anomalous verdict for submission={}", submission.getSubmissionId());
            return false;
        }

        AnomalyRecord anomaly = AnomalyRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .subjectId(submission.getSubjectId())
                .submissionId(submission.getSubmissionId())
                .quantity(submission.getQuantity())
                .mean(verdict.mean())
                .stdDev(verdict.stdDev())
                .zScore(verdict.zScore())
                .flagged(true)
                .createdAt(clock.millis())
                .build();

        try {
            anomalyRecordRepository.save(anomaly);
        } catch (Exception e) {
            metricsConfig.recordAnomalyRecordSave("error");
            log.error("Anomaly record save failed for subject={}, submission={}, stage=record, cause={}",
                    submission.getSubjectId(), submission.getSubmissionId(), e.getMessage(), e);
            return false;
        }
        metricsConfig.recordAnomalyRecordSave("success");

        reportArchiveService.archive(anomaly);
        try {
            notificationService.notifyAnomaly(anomaly);
        } catch (Exception e) {
            log.warn("Could not dispatch anomaly notification for subject={}: {}",
                    submission.getSubjectId(), e.getMessage());
        }
        return true;
    }
}

package com.waste.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.config.MetricsConfig;
import com.waste.anomaly.model.AnomalyRecord;
import com.waste.anomaly.repository.AnomalyRecordRepository;
import com.waste.anomaly.repository.ReportArchiveRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores a serialized report for each flagged record and links it back to the record.
 * Archiving is optional: a failure leaves the record without a report pointer.
 */
@Service
public class ReportArchiveService {

    private static final Logger log = LoggerFactory.getLogger(ReportArchiveService.class);

    private final ReportArchiveRepository archiveRepository;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final ObjectMapper objectMapper;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ReportArchiveService(ReportArchiveRepository archiveRepository,
                                AnomalyRecordRepository anomalyRecordRepository,
                                ObjectMapper objectMapper,
                                DetectionConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.archiveRepository = archiveRepository;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.objectMapper = objectMapper;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Optional<String> archive(AnomalyRecord anomaly) {
        if (!config.getArchive().isEnabled()) {
            return Optional.empty();
        }

        String reportKey = reportKey(anomaly);
        try {
            String report = objectMapper.writeValueAsString(buildReport(anomaly));
            archiveRepository.save(reportKey, report, clock.millis());
            anomalyRecordRepository.updateReportKey(anomaly.getRecordId(), reportKey);
            anomaly.setReportKey(reportKey);
            metricsConfig.recordReportArchive("success");
            return Optional.of(reportKey);
        } catch (Exception e) {
            metricsConfig.recordReportArchive("error");
            log.warn("Report archive failed for subject={}, record={}, stage=archive, cause={}",
                    anomaly.getSubjectId(), anomaly.getRecordId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<String> findReport(String reportKey) {
        return Optional.ofNullable(archiveRepository.findReport(reportKey));
    }

    static String reportKey(AnomalyRecord anomaly) {
        return anomaly.getSubjectId() + ":" + anomaly.getCreatedAt() + ":" + anomaly.getRecordId();
    }

    private Map<String, Object> buildReport(AnomalyRecord anomaly) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("subjectId", anomaly.getSubjectId());
        report.put("submissionId", anomaly.getSubmissionId());
        report.put("recordId", anomaly.getRecordId());
        report.put("quantity", anomaly.getQuantity());
        report.put("mean", anomaly.getMean());
        report.put("stdDev", anomaly.getStdDev());
        report.put("zScore", anomaly.getZScore());
        report.put("createdAt", DateTimeFormatter.ISO_OFFSET_DATE_TIME
                .format(Instant.ofEpochMilli(anomaly.getCreatedAt()).atZone(clock.getZone())));
        return report;
    }
}

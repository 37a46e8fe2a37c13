package com.waste.anomaly.service;

import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.AnomalyRecord;
import com.waste.anomaly.model.HighRiskSubject;
import com.waste.anomaly.model.OversightDashboard;
import com.waste.anomaly.repository.AnomalyRecordRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only dashboard queries over anomaly records. Each query reads the store independently;
 * no consistency is promised across them.
 */
@Service
public class OversightAnalyticsService {

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final DetectionConfig config;
    private final Clock clock;

    public OversightAnalyticsService(AnomalyRecordRepository anomalyRecordRepository,
                                     DetectionConfig config,
                                     Clock clock) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Records created during the current civil day.
     */
    public long countToday() {
        Instant now = clock.instant();
        long from = TimeWindows.startOfDay(now, clock.getZone()).toEpochMilli();
        long to = TimeWindows.startOfNextDay(now, clock.getZone()).toEpochMilli();
        return anomalyRecordRepository.countCreatedBetween(from, to);
    }

    public List<AnomalyRecord> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return anomalyRecordRepository.findRecent(limit);
    }

    public List<AnomalyRecord> recent() {
        return recent(config.getOversight().getRecentLimit());
    }

    /**
     * Subject ids with at least {@code threshold} records in the trailing {@code windowDays},
     * most anomalies first.
     */
    public List<String> highRisk(int windowDays, int threshold) {
        return highRiskDetails(windowDays, threshold).stream()
                .map(HighRiskSubject::subjectId)
                .toList();
    }

    public List<String> highRisk() {
        DetectionConfig.Oversight oversight = config.getOversight();
        return highRisk(oversight.getHighRiskWindowDays(), oversight.getHighRiskThreshold());
    }

    public List<HighRiskSubject> highRiskDetails(int windowDays, int threshold) {
        Instant now = clock.instant();
        long from = TimeWindows.daysBefore(now, windowDays, clock.getZone()).toEpochMilli();
        // Upper bound just past now so records stamped this millisecond still count
        long to = now.toEpochMilli() + 1;

        // Bounded to the trailing window by the repository before grouping
        Map<String, Long> countsBySubject = anomalyRecordRepository.findCreatedBetween(from, to).stream()
                .collect(Collectors.groupingBy(AnomalyRecord::getSubjectId, Collectors.counting()));

        return countsBySubject.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .map(e -> new HighRiskSubject(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(HighRiskSubject::anomalyCount).reversed()
                        .thenComparing(HighRiskSubject::subjectId))
                .toList();
    }

    public OversightDashboard dashboard() {
        return OversightDashboard.builder()
                .anomaliesToday(countToday())
                .recent(recent())
                .highRiskSubjects(highRisk())
                .build();
    }
}

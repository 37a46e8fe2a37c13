package com.waste.anomaly.service;

import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.Submission;
import com.waste.anomaly.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Supplies the trailing quantity window a submission is compared against.
 */
@Service
public class HistoricalWindowService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalWindowService.class);

    private final SubmissionRepository submissionRepository;
    private final DetectionConfig config;
    private final Clock clock;

    public HistoricalWindowService(SubmissionRepository submissionRepository,
                                   DetectionConfig config,
                                   Clock clock) {
        this.submissionRepository = submissionRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Quantities of {@code subjectId}'s submissions created within {@code days} calendar days
     * before {@code asOf}, newest first. Returns an empty list if the store cannot be read.
     */
    public List<Double> fetchWindow(String subjectId, Instant asOf, int days) {
        return findWindow(subjectId, asOf, days, null).orElse(Collections.emptyList());
    }

    public List<Double> fetchWindow(String subjectId, Instant asOf) {
        return fetchWindow(subjectId, asOf, config.getWindowDays());
    }

    /**
     * Window over the configured number of days, leaving out {@code excludeSubmissionId}.
     * Empty when the store could not be read, as opposed to a present but empty list.
     */
    public Optional<List<Double>> findWindow(String subjectId, Instant asOf, String excludeSubmissionId) {
        return findWindow(subjectId, asOf, config.getWindowDays(), excludeSubmissionId);
    }

    private Optional<List<Double>> findWindow(String subjectId, Instant asOf, int days, String excludeSubmissionId) {
        long cutoff = TimeWindows.daysBefore(asOf, days, clock.getZone()).toEpochMilli();
        try {
            List<Double> quantities = submissionRepository.findBySubjectSince(subjectId, cutoff).stream()
                    .filter(s -> excludeSubmissionId == null || !excludeSubmissionId.equals(s.getSubmissionId()))
                    .map(Submission::getQuantity)
                    .filter(Objects::nonNull)
                    .toList();
            return Optional.of(quantities);
        } catch (Exception e) {
            log.warn("Window fetch failed for subject={}, stage=window, cause={}", subjectId, e.getMessage(), e);
            return Optional.empty();
        }
    }
}

package com.waste.anomaly.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.waste.anomaly.client.DetectionClient;
import com.waste.anomaly.config.MetricsConfig;
import com.waste.anomaly.model.DetectionOutcome;
import com.waste.anomaly.model.PagedResponse;
import com.waste.anomaly.model.Submission;
import com.waste.anomaly.model.SubmissionOutcome;
import com.waste.anomaly.model.SubmissionStage;
import com.waste.anomaly.model.Verdict;
import com.waste.anomaly.repository.SubmissionRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records a submission and then screens it for anomalies.
 *
 * Flow:
 * 1. Persist the submission (RECEIVED -> PERSISTED). Failure here is the only error the caller sees.
 * 2. Load the trailing window (WINDOW_FETCHED | WINDOW_UNAVAILABLE)
 * 3. Detect (CLASSIFIED | DETECTION_UNAVAILABLE), auditing every attempt
 * 4. Store an anomaly record when flagged (RECORD_SAVED | RECORD_SKIPPED | RECORD_SAVE_FAILED)
 * 5. COMPLETED
 *
 * Steps 2-4 are best-effort and never retried: any failure skips straight to COMPLETED.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final SubmissionRepository submissionRepository;
    private final HistoricalWindowService windowService;
    private final DetectionClient detectionClient;
    private final AnomalyRecordService anomalyRecordService;
    private final AuditLogService auditLogService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public SubmissionService(SubmissionRepository submissionRepository,
                             HistoricalWindowService windowService,
                             DetectionClient detectionClient,
                             AnomalyRecordService anomalyRecordService,
                             AuditLogService auditLogService,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.submissionRepository = submissionRepository;
        this.windowService = windowService;
        this.detectionClient = detectionClient;
        this.anomalyRecordService = anomalyRecordService;
        this.auditLogService = auditLogService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException       if the subject or quantity is missing
     * @throws DuplicateSubmissionException   if a submission with the same id is already stored
     * @throws SubmissionPersistenceException if the submission itself could not be stored
     */
    @Observed(name = "submission.submit", contextualName = "submit-waste-quantity")
    public SubmissionOutcome submit(Submission submission) {
        if (submission.getSubjectId() == null || submission.getSubjectId().isBlank()) {
            throw new IllegalArgumentException("subjectId is required");
        }
        if (submission.getQuantity() == null || !Double.isFinite(submission.getQuantity())) {
            throw new IllegalArgumentException("quantity must be a finite number");
        }

        List<SubmissionStage> stages = new ArrayList<>();
        stages.add(SubmissionStage.RECEIVED);

        if (submission.getSubmissionId() == null || submission.getSubmissionId().isBlank()) {
            submission.setSubmissionId(UUID.randomUUID().toString());
        }
        if (submission.getCreatedAt() == 0) {
            submission.setCreatedAt(clock.millis());
        }

        try {
            submissionRepository.save(submission);
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                metricsConfig.recordSubmission("duplicate");
                log.warn("Submission {} already stored, rejecting resubmission for subject={}",
                        submission.getSubmissionId(), submission.getSubjectId());
                throw new DuplicateSubmissionException(submission.getSubmissionId());
            }
            throw persistFailed(submission, e);
        } catch (Exception e) {
            throw persistFailed(submission, e);
        }
        stages.add(SubmissionStage.PERSISTED);
        metricsConfig.recordSubmission("created");

        Verdict verdict = null;
        try {
            verdict = screen(submission, stages);
        } catch (Exception e) {
            log.warn("Anomaly screening aborted for subject={}, submission={}, after stage={}: {}",
                    submission.getSubjectId(), submission.getSubmissionId(),
                    stages.get(stages.size() - 1), e.getMessage(), e);
        }

        stages.add(SubmissionStage.COMPLETED);
        return new SubmissionOutcome(submission, List.copyOf(stages), verdict);
    }

    private SubmissionPersistenceException persistFailed(Submission submission, Exception e) {
        metricsConfig.recordSubmission("failed");
        log.error("Submission persist failed for subject={}, submission={}: {}",
                submission.getSubjectId(), submission.getSubmissionId(), e.getMessage(), e);
        return new SubmissionPersistenceException(
                "Submission could not be stored for subject " + submission.getSubjectId(), e);
    }

    private Verdict screen(Submission submission, List<SubmissionStage> stages) {
        String subjectId = submission.getSubjectId();
        double quantity = submission.getQuantity();

        Optional<List<Double>> window = windowService.findWindow(
                subjectId, Instant.ofEpochMilli(submission.getCreatedAt()), submission.getSubmissionId());
        if (window.isEmpty()) {
            stages.add(SubmissionStage.WINDOW_UNAVAILABLE);
            stages.add(SubmissionStage.RECORD_SKIPPED);
            return null;
        }
        List<Double> history = window.get();
        stages.add(SubmissionStage.WINDOW_FETCHED);

        DetectionOutcome outcome = detectionClient.detect(subjectId, quantity, history);
        auditLogService.recordClassification(subjectId, quantity, outcome);

        if (outcome instanceof DetectionOutcome.Unavailable unavailable) {
            metricsConfig.recordDetectionOutcome("unavailable");
            stages.add(SubmissionStage.DETECTION_UNAVAILABLE);
            stages.add(SubmissionStage.RECORD_SKIPPED);
            log.info("Detection skipped for subject={}, submission={}: {}",
                    subjectId, submission.getSubmissionId(), unavailable.reason());
            return null;
        }

        Verdict verdict = ((DetectionOutcome.Detected) outcome).verdict();
        metricsConfig.recordDetectionOutcome("classified");
        stages.add(SubmissionStage.CLASSIFIED);

        if (!verdict.anomaly()) {
            stages.add(SubmissionStage.RECORD_SKIPPED);
            return verdict;
        }

        metricsConfig.recordAnomalyFlagged(verdict.zScore());
        log.warn("Anomaly detected for subject={}, submission={}: quantity={}, mean={}, stdDev={}, z={}",
                subjectId, submission.getSubmissionId(), quantity, verdict.mean(), verdict.stdDev(), verdict.zScore());

        boolean saved = anomalyRecordService.persist(submission, verdict);
        stages.add(saved ? SubmissionStage.RECORD_SAVED : SubmissionStage.RECORD_SAVE_FAILED);
        return verdict;
    }

    public Submission getSubmission(String submissionId) {
        return submissionRepository.findById(submissionId);
    }

    public PagedResponse<Submission> getSubmissionsBySubject(String subjectId, int limit, Long before) {
        return submissionRepository.findBySubjectId(subjectId, limit, before);
    }
}

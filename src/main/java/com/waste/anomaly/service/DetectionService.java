package com.waste.anomaly.service;

import com.waste.anomaly.engine.ZScoreClassifier;
import com.waste.anomaly.model.DetectionRequest;
import com.waste.anomaly.model.DetectionResponse;
import com.waste.anomaly.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Server side of the detection endpoint: validates the wire request and runs the classifier.
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final ZScoreClassifier classifier;

    public DetectionService(ZScoreClassifier classifier) {
        this.classifier = classifier;
    }

    public DetectionResponse detect(DetectionRequest request) {
        if (request == null) {
            throw new InvalidDetectionRequestException("request body is required");
        }
        if (request.subjectId() == null || request.subjectId().isBlank()) {
            throw new InvalidDetectionRequestException("subjectId is required");
        }
        if (request.currentQuantity() == null || !Double.isFinite(request.currentQuantity())) {
            throw new InvalidDetectionRequestException("currentQuantity must be a finite number");
        }
        if (request.history() == null) {
            throw new InvalidDetectionRequestException("history must be an array of numbers");
        }

        List<Double> samples = numericSamples(request.history());
        if (samples.size() < request.history().size()) {
            log.debug("Dropped {} non-numeric history entries for subject={}",
                    request.history().size() - samples.size(), request.subjectId());
        }

        Verdict verdict = classifier.classify(request.currentQuantity(), samples);
        return DetectionResponse.of(request.subjectId(), verdict);
    }

    static List<Double> numericSamples(List<Object> raw) {
        return raw.stream()
                .filter(v -> v instanceof Number)
                .map(v -> ((Number) v).doubleValue())
                .filter(Double::isFinite)
                .toList();
    }
}

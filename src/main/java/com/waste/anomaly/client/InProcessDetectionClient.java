package com.waste.anomaly.client;

import com.waste.anomaly.engine.ZScoreClassifier;
import com.waste.anomaly.model.DetectionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the classifier in the calling thread. Used when {@code detection.remote.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "detection.remote", name = "enabled", havingValue = "false")
public class InProcessDetectionClient implements DetectionClient {

    private static final Logger log = LoggerFactory.getLogger(InProcessDetectionClient.class);

    private final ZScoreClassifier classifier;

    public InProcessDetectionClient(ZScoreClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public DetectionOutcome detect(String subjectId, double currentQuantity, List<Double> history) {
        try {
            return DetectionOutcome.detected(classifier.classify(currentQuantity, history));
        } catch (RuntimeException e) {
            log.warn("In-process detection failed for subject={}: {}", subjectId, e.getMessage(), e);
            return DetectionOutcome.unavailable("classifier failure: " + e.getMessage());
        }
    }
}

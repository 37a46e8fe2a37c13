package com.waste.anomaly.model;

import java.util.List;

/**
 * Trace of one orchestrated submission. {@code verdict} is null unless the detector answered.
 */
public record SubmissionOutcome(Submission submission, List<SubmissionStage> stages, Verdict verdict) {

    public boolean reached(SubmissionStage stage) {
        return stages.contains(stage);
    }
}

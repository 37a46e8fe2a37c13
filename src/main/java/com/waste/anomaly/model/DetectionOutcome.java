package com.waste.anomaly.model;

import java.util.Objects;

/**
 * Result of one detection attempt: either a verdict or a reason the detector could not answer.
 * Callers branch on both arms; an unavailable detector is never reported as an exception.
 */
public sealed interface DetectionOutcome permits DetectionOutcome.Detected, DetectionOutcome.Unavailable {

    static DetectionOutcome detected(Verdict verdict) {
        return new Detected(verdict);
    }

    static DetectionOutcome unavailable(String reason) {
        return new Unavailable(reason);
    }

    record Detected(Verdict verdict) implements DetectionOutcome {
        public Detected {
            Objects.requireNonNull(verdict, "verdict");
        }
    }

    record Unavailable(String reason) implements DetectionOutcome {}
}

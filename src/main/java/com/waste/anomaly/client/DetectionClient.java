package com.waste.anomaly.client;

import com.waste.anomaly.model.DetectionOutcome;

import java.util.List;

/**
 * Boundary to the anomaly detector, which may live in another process.
 */
public interface DetectionClient {

    /**
     * Classify {@code currentQuantity} against {@code history}.
     *
     * @param subjectId       facility the quantity belongs to
     * @param currentQuantity the newly submitted quantity
     * @param history         trailing window, newest first
     * @return a verdict, or {@link DetectionOutcome.Unavailable} on any failure; never throws
     */
    DetectionOutcome detect(String subjectId, double currentQuantity, List<Double> history);
}

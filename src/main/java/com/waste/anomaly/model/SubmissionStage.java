package com.waste.anomaly.model;

/**
 * States a submission passes through. Only {@link #RECEIVED} to {@link #PERSISTED} can fail the request.
 */
public enum SubmissionStage {
    RECEIVED,
    PERSISTED,
    WINDOW_FETCHED,
    WINDOW_UNAVAILABLE,
    CLASSIFIED,
    DETECTION_UNAVAILABLE,
    RECORD_SAVED,
    RECORD_SKIPPED,
    RECORD_SAVE_FAILED,
    COMPLETED
}

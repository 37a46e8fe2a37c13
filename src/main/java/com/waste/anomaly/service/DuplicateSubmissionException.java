package com.waste.anomaly.service;

/**
 * A submission with this id is already stored. Stored submissions are immutable.
 */
public class DuplicateSubmissionException extends RuntimeException {

    private final String submissionId;

    public DuplicateSubmissionException(String submissionId) {
        super("Submission " + submissionId + " already exists");
        this.submissionId = submissionId;
    }

    public String getSubmissionId() {
        return submissionId;
    }
}

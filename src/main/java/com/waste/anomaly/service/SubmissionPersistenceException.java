package com.waste.anomaly.service;

/**
 * The primary submission write failed. The only error a submission caller ever sees.
 */
public class SubmissionPersistenceException extends RuntimeException {

    public SubmissionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

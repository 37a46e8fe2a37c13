package com.waste.anomaly.security;

public class OversightAccessDeniedException extends RuntimeException {

    public OversightAccessDeniedException(String message) {
        super(message);
    }
}

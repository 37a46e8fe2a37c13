package com.waste.anomaly.service;

public class InvalidDetectionRequestException extends IllegalArgumentException {

    public InvalidDetectionRequestException(String message) {
        super(message);
    }
}

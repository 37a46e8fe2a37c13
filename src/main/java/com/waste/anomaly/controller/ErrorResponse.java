package com.waste.anomaly.controller;

public record ErrorResponse(int status, String error, String message) {}

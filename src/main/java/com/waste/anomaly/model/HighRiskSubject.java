package com.waste.anomaly.model;

public record HighRiskSubject(String subjectId, long anomalyCount) {}

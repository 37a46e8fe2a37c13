package com.waste.anomaly.model;

/**
 * Classifier output. Mean and std-dev are rounded to 2 decimals, z-score to 3.
 */
public record Verdict(boolean anomaly, double zScore, double mean, double stdDev) {

    public static Verdict insufficientData() {
        return new Verdict(false, 0.0, 0.0, 0.0);
    }

    public static Verdict zeroSpread(double mean) {
        return new Verdict(false, 0.0, mean, 0.0);
    }
}

package com.waste.anomaly.engine;

import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.Verdict;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Classifies a submitted quantity against the facility's historical window using a z-score.
 *
 * Logic: with at least minSamples usable values, z = (current - mean) / sampleStdDev and the
 * quantity is anomalous when |z| >= zScoreThreshold. The threshold is inclusive and compared at
 * full precision; only the returned figures are rounded.
 *
 * Example: history [100, 110, 105, 95, 100] has mean 102 and std-dev 5.70. A quantity of 150
 * gives z = 8.42 (anomalous), a quantity of 103 gives z = 0.175 (normal).
 *
 * Stateless and safe to call concurrently.
 */
@Component
public class ZScoreClassifier {

    private final int minSamples;
    private final double zScoreThreshold;

    @Autowired
    public ZScoreClassifier(DetectionConfig config) {
        this(config.getMinSamples(), config.getZScoreThreshold());
    }

    public ZScoreClassifier(int minSamples, double zScoreThreshold) {
        this.minSamples = minSamples;
        this.zScoreThreshold = zScoreThreshold;
    }

    public Verdict classify(double current, List<? extends Number> history) {
        double[] samples = usableSamples(history);
        int n = samples.length;
        if (n < minSamples || n < 2) {
            return Verdict.insufficientData();
        }

        double sum = 0.0;
        double min = samples[0];
        double max = samples[0];
        for (double v : samples) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        // Constant history is zero spread even when the summed mean carries rounding residue
        if (min == max) {
            return Verdict.zeroSpread(round(min, 2));
        }

        double squares = 0.0;
        for (double v : samples) {
            double d = v - mean;
            squares += d * d;
        }
        // Bessel-corrected sample standard deviation
        double stdDev = Math.sqrt(squares / (n - 1));

        double z = (current - mean) / stdDev;
        boolean anomaly = Math.abs(z) >= zScoreThreshold;
        return new Verdict(anomaly, round(z, 3), round(mean, 2), round(stdDev, 2));
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    private static double[] usableSamples(List<? extends Number> history) {
        if (history == null || history.isEmpty()) return new double[0];
        return history.stream()
                .filter(v -> v != null)
                .mapToDouble(Number::doubleValue)
                .filter(Double::isFinite)
                .toArray();
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}

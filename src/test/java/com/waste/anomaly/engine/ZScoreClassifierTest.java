package com.waste.anomaly.engine;

import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.Verdict;
import com.waste.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ZScoreClassifierTest {

    private ZScoreClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ZScoreClassifier(5, 2.5);
    }

    @Test
    void classify_largeSpike_isAnomalous() {
        Verdict verdict = classifier.classify(150.0, TestDataFactory.REFERENCE_HISTORY);

        assertThat(verdict.anomaly()).isTrue();
        assertThat(verdict.mean()).isEqualTo(102.0);
        assertThat(verdict.stdDev()).isEqualTo(5.7);
        assertThat(verdict.zScore()).isCloseTo(8.42, within(0.001));
    }

    @Test
    void classify_quantityNearMean_isNormal() {
        Verdict verdict = classifier.classify(103.0, TestDataFactory.REFERENCE_HISTORY);

        assertThat(verdict.anomaly()).isFalse();
        assertThat(verdict.zScore()).isCloseTo(0.175, within(0.001));
        assertThat(verdict.mean()).isEqualTo(102.0);
    }

    @Test
    void classify_fewerThanMinSamples_neverFlags() {
        Verdict verdict = classifier.classify(10_000.0, List.of(100.0, 110.0, 105.0, 95.0));

        assertThat(verdict).isEqualTo(Verdict.insufficientData());
        assertThat(verdict.anomaly()).isFalse();
        assertThat(verdict.zScore()).isEqualTo(0.0);
        assertThat(verdict.mean()).isEqualTo(0.0);
        assertThat(verdict.stdDev()).isEqualTo(0.0);
    }

    @Test
    void classify_emptyOrNullHistory_neverFlags() {
        assertThat(classifier.classify(500.0, Collections.emptyList())).isEqualTo(Verdict.insufficientData());
        assertThat(classifier.classify(500.0, null)).isEqualTo(Verdict.insufficientData());
    }

    @Test
    void classify_identicalHistory_zeroSpreadIsNotAnomalous() {
        Verdict verdict = classifier.classify(200.0, List.of(50.0, 50.0, 50.0, 50.0, 50.0));

        assertThat(verdict.anomaly()).isFalse();
        assertThat(verdict.zScore()).isEqualTo(0.0);
        assertThat(verdict.stdDev()).isEqualTo(0.0);
        assertThat(verdict.mean()).isEqualTo(50.0);
    }

    @Test
    void classify_constantDecimalHistory_zeroSpreadIsNotAnomalous() {
        List<Double> history = List.of(12.7, 12.7, 12.7, 12.7, 12.7, 12.7);

        Verdict verdict = classifier.classify(13.0, history);

        assertThat(verdict).isEqualTo(Verdict.zeroSpread(12.7));
        assertThat(verdict.anomaly()).isFalse();
    }

    @Test
    void classify_constantHistoriesOfCommonDecimals_neverFlag() {
        for (double value : new double[]{0.1, 0.7, 1.1, 3.3, 33.33, 99.9}) {
            for (int length : new int[]{6, 7, 10, 30}) {
                Verdict verdict = classifier.classify(value * 10, Collections.nCopies(length, value));

                assertThat(verdict.anomaly()).as("%s x %d", value, length).isFalse();
                assertThat(verdict.zScore()).as("%s x %d", value, length).isEqualTo(0.0);
                assertThat(verdict.stdDev()).as("%s x %d", value, length).isEqualTo(0.0);
            }
        }
    }

    @Test
    void classify_extremeZScore_isNotClamped() {
        // mean 2e-10, std-dev sqrt(2e-19): z is about 2.236e19
        List<Double> history = List.of(0.0, 0.0, 0.0, 0.0, 1e-9);

        Verdict verdict = classifier.classify(1e10, history);

        assertThat(verdict.anomaly()).isTrue();
        assertThat(verdict.zScore()).isCloseTo(2.236e19, within(1e16));
    }

    @Test
    void classify_veryLargeQuantities_keepMeanAndSpread() {
        List<Double> history = List.of(1e17, 2e17, 3e17, 4e17, 5e17);

        Verdict verdict = classifier.classify(3e17, history);

        assertThat(verdict.mean()).isEqualTo(3e17);
        assertThat(verdict.stdDev()).isCloseTo(1.5811e17, within(1e13));
        assertThat(verdict.zScore()).isEqualTo(0.0);
        assertThat(verdict.anomaly()).isFalse();
    }

    @Test
    void classify_exactlyAtThreshold_isAnomalous() {
        Verdict verdict = classifier.classify(15.0, TestDataFactory.UNIT_SPREAD_HISTORY);

        assertThat(verdict.zScore()).isEqualTo(2.5);
        assertThat(verdict.anomaly()).isTrue();
    }

    @Test
    void classify_justBelowThreshold_isNormal() {
        Verdict verdict = classifier.classify(14.9998, TestDataFactory.UNIT_SPREAD_HISTORY);

        assertThat(verdict.anomaly()).isFalse();
    }

    @Test
    void classify_negativeDeviationAtThreshold_isAnomalous() {
        Verdict verdict = classifier.classify(5.0, TestDataFactory.UNIT_SPREAD_HISTORY);

        assertThat(verdict.zScore()).isEqualTo(-2.5);
        assertThat(verdict.anomaly()).isTrue();
    }

    @Test
    void classify_ignoresNullAndNonFiniteSamples() {
        List<Double> noisy = Arrays.asList(100.0, null, 110.0, Double.NaN, 105.0, 95.0,
                Double.POSITIVE_INFINITY, 100.0);

        Verdict clean = classifier.classify(150.0, TestDataFactory.REFERENCE_HISTORY);
        Verdict filtered = classifier.classify(150.0, noisy);

        assertThat(filtered).isEqualTo(clean);
    }

    @Test
    void classify_tooFewUsableSamplesAfterFiltering_neverFlags() {
        List<Double> noisy = Arrays.asList(100.0, null, 110.0, Double.NaN, 105.0, 95.0);

        assertThat(classifier.classify(1_000.0, noisy)).isEqualTo(Verdict.insufficientData());
    }

    @Test
    void classify_usesSampleStandardDeviation() {
        // Squared deviations sum to 20: population std-dev 1.826, sample std-dev sqrt(20 / 5) = 2.0
        List<Double> history = List.of(2.0, 4.0, 6.0, 8.0, 5.0, 5.0);

        Verdict verdict = classifier.classify(9.0, history);

        assertThat(verdict.mean()).isEqualTo(5.0);
        assertThat(verdict.stdDev()).isEqualTo(2.0);
        assertThat(verdict.zScore()).isEqualTo(2.0);
        assertThat(verdict.anomaly()).isFalse();
    }

    @Test
    void classify_acceptsIntegerSamples() {
        Verdict verdict = classifier.classify(150.0, List.of(100, 110, 105, 95, 100));

        assertThat(verdict.anomaly()).isTrue();
        assertThat(verdict.mean()).isEqualTo(102.0);
    }

    @Test
    void classify_configuredThresholdAndMinSamplesApply() {
        DetectionConfig config = new DetectionConfig();
        config.setMinSamples(3);
        config.setZScoreThreshold(1.0);
        ZScoreClassifier configured = new ZScoreClassifier(config);

        Verdict verdict = configured.classify(12.0, List.of(8.0, 10.0, 12.0));

        // mean 10, std 2, z = 1.0
        assertThat(verdict.anomaly()).isTrue();
        assertThat(configured.getZScoreThreshold()).isEqualTo(1.0);
    }
}

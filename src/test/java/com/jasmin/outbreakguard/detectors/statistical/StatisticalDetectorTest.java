package com.jasmin.outbreakguard.detectors.statistical;

import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticalDetectorTest {

    private final StatisticalDetector detector = new StatisticalDetector(new StatisticalProperties());

    // mean 15, std 5, median 15, MAD 5, Q1 10, Q3 20
    private final Baseline baseline = Baseline.builder()
            .mean(15).stdDev(5).median(15).mad(5).q1(10).q3(20).sampleCount(20)
            .build();

    @Test
    void insufficientBaselineNeverVotes() {
        DetectorVerdict v = detector.evaluate(100, Baseline.insufficient(5, null, null));

        assertThat(v.isInsufficientData()).isTrue();
        assertThat(v.isAnomalous()).isFalse();
        assertThat(v.votes()).isFalse();
    }

    @Test
    void largeSpikeFiresAllThreeTests() {
        DetectorVerdict v = detector.evaluate(45, baseline);

        assertThat(v.isAnomalous()).isTrue();
        assertThat(v.getScore()).isCloseTo(6.0, within(1e-9));
        assertThat(v.getConfidence()).isEqualTo(1.0);
        assertThat(v.getFiredMethods()).containsExactly(
                DetectionMethod.Z_SCORE, DetectionMethod.IQR, DetectionMethod.MODIFIED_Z_SCORE);
    }

    @Test
    void zScoreIsSymmetricAroundTheMean() {
        DetectorVerdict above = detector.evaluate(30, baseline);
        DetectorVerdict below = detector.evaluate(0, baseline);

        assertThat(above.getScore()).isCloseTo(3.0, within(1e-9));
        assertThat(below.getScore()).isCloseTo(-3.0, within(1e-9));
        assertThat(above.getFiredMethods()).containsExactly(DetectionMethod.Z_SCORE);
        assertThat(below.getFiredMethods()).containsExactly(DetectionMethod.Z_SCORE);
        assertThat(above.getConfidence()).isEqualTo(below.getConfidence());
    }

    @Test
    void valuesInsideInterquartileRangeNeverFireIqr() {
        for (double v = 10.0; v <= 20.0; v += 0.5) {
            assertThat(detector.iqr(v, baseline).fired).as("value %s", v).isFalse();
            assertThat(detector.evaluate(v, baseline).isAnomalous()).as("value %s", v).isFalse();
        }
    }

    @Test
    void iqrConfidenceGrowsWithDistanceBeyondFence() {
        // upper fence 20 + 1.5 * 10 = 35
        StatisticalDetector.TestResult near = detector.iqr(40, baseline);
        StatisticalDetector.TestResult far = detector.iqr(60, baseline);

        assertThat(near.fired).isTrue();
        assertThat(near.confidence).isCloseTo(0.5, within(1e-9));
        assertThat(far.confidence).isEqualTo(1.0);
    }

    @Test
    void modifiedZScoreUsesMedianAndMad() {
        StatisticalDetector.TestResult m = detector.modifiedZScore(45, baseline);

        assertThat(m.statistic).isCloseTo(0.6745 * 30 / 5, within(1e-9));
        assertThat(m.fired).isTrue();
    }

    @Test
    void zeroSpreadBaselineStaysFinite() {
        Baseline flat = Baseline.builder().mean(10).median(10).q1(10).q3(10).sampleCount(10).build();

        DetectorVerdict same = detector.evaluate(10, flat);
        DetectorVerdict moved = detector.evaluate(11, flat);

        assertThat(same.isAnomalous()).isFalse();
        assertThat(moved.isAnomalous()).isTrue();
        assertThat(moved.getConfidence()).isEqualTo(1.0);
        assertThat(Double.isFinite(moved.getScore())).isTrue();
    }

    @Test
    void disabledDetectorIsNotApplicable() {
        StatisticalProperties props = new StatisticalProperties();
        props.setEnabled(false);

        assertThat(new StatisticalDetector(props).detect(null)).isEmpty();
    }
}

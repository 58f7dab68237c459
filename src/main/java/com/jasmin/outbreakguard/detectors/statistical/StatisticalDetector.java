package com.jasmin.outbreakguard.detectors.statistical;

import com.jasmin.outbreakguard.detectors.DetectionContext;
import com.jasmin.outbreakguard.detectors.Detector;
import com.jasmin.outbreakguard.detectors.DetectorUtils;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Z-score, IQR fence and MAD-based modified z-score against the baseline.
 * The reading is anomalous if any test fires; the strongest firing confidence wins.
 */
@Service
@Order(1)
@RequiredArgsConstructor
public class StatisticalDetector implements Detector {

    private static final double MAD_SCALE = 0.6745;

    private final StatisticalProperties cfg;

    @Override
    public Optional<DetectorVerdict> detect(DetectionContext ctx) {
        if (!cfg.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(evaluate(ctx.value(), ctx.getBaseline()));
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.STATISTICAL;
    }

    public DetectorVerdict evaluate(double value, Baseline baseline) {
        if (baseline == null || baseline.isInsufficientData()) {
            int n = baseline == null ? 0 : baseline.getSampleCount();
            return DetectorVerdict.insufficientData(family(), "baseline has " + n + " samples");
        }

        TestResult z = zScore(value, baseline);
        TestResult iqr = iqr(value, baseline);
        TestResult mz = modifiedZScore(value, baseline);

        List<TestResult> fired = new ArrayList<>();
        for (TestResult t : List.of(z, iqr, mz)) {
            if (t.fired) fired.add(t);
        }

        String details = String.format(Locale.ROOT, "z=%.2f, iqrExcess=%.2f, M=%.2f (μ=%.2f, σ=%.2f, median=%.2f, MAD=%.2f)",
                z.statistic, iqr.statistic, mz.statistic, baseline.getMean(), baseline.getStdDev(),
                baseline.getMedian(), baseline.getMad());

        if (fired.isEmpty()) {
            double strongest = Math.max(z.confidence, Math.max(iqr.confidence, mz.confidence));
            return DetectorVerdict.normal(family(), z.statistic, strongest, details);
        }

        DetectorVerdict.DetectorVerdictBuilder b = DetectorVerdict.builder()
                .family(family())
                .anomalous(true)
                .score(z.statistic)
                .details(details);
        double confidence = 0.0;
        for (TestResult t : fired) {
            b.firedMethod(t.method);
            confidence = Math.max(confidence, t.confidence);
        }
        return b.confidence(confidence).build();
    }

    /** z = (value - mean) / std; confidence = min(|z| / saturation, 1). */
    TestResult zScore(double value, Baseline b) {
        double std = DetectorUtils.floor(b.getStdDev(), cfg.getEpsilon());
        double z = (value - b.getMean()) / std;
        boolean fired = Math.abs(z) > cfg.getZThreshold();
        return new TestResult(DetectionMethod.Z_SCORE, z, fired,
                DetectorUtils.clamp01(Math.abs(z) / cfg.getZSaturation()));
    }

    /** Fires outside [Q1 - k·IQR, Q3 + k·IQR]; statistic is the distance beyond the fence in IQR units. */
    TestResult iqr(double value, Baseline b) {
        double range = b.getIqr();
        double lower = b.getQ1() - cfg.getIqrMultiplier() * range;
        double upper = b.getQ3() + cfg.getIqrMultiplier() * range;
        double beyond = value > upper ? value - upper : (value < lower ? lower - value : 0.0);
        double excess = beyond / DetectorUtils.floor(range, cfg.getEpsilon());
        boolean fired = value > upper || value < lower;
        return new TestResult(DetectionMethod.IQR, excess, fired, fired ? DetectorUtils.clamp01(excess) : 0.0);
    }

    /** M = 0.6745 · (value - median) / MAD. */
    TestResult modifiedZScore(double value, Baseline b) {
        double mad = DetectorUtils.floor(b.getMad(), cfg.getEpsilon());
        double m = MAD_SCALE * (value - b.getMedian()) / mad;
        boolean fired = Math.abs(m) > cfg.getModifiedZThreshold();
        return new TestResult(DetectionMethod.MODIFIED_Z_SCORE, m, fired,
                DetectorUtils.clamp01(Math.abs(m) / cfg.getModifiedZSaturation()));
    }

    static final class TestResult {
        final DetectionMethod method;
        final double statistic;
        final boolean fired;
        final double confidence;

        TestResult(DetectionMethod method, double statistic, boolean fired, double confidence) {
            this.method = method;
            this.statistic = statistic;
            this.fired = fired;
            this.confidence = confidence;
        }
    }
}

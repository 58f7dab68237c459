package com.jasmin.outbreakguard.detectors.environmental;

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

import java.util.Locale;
import java.util.Optional;

/**
 * Sensitive path for environmental health metrics: a modest rise is flagged when
 * the reading is already above the metric's health-risk level, even though it
 * stays inside the statistical fences.
 */
@Service
@Order(4)
@RequiredArgsConstructor
public class EnvironmentalDetector implements Detector {

    private static final double EPSILON = 1e-9;

    private final EnvironmentalProperties cfg;

    @Override
    public Optional<DetectorVerdict> detect(DetectionContext ctx) {
        if (!cfg.isEnabled()) {
            return Optional.empty();
        }
        Double riskLevel = cfg.getHealthRiskLevels().get(ctx.getKey().getMetric());
        if (riskLevel == null) {
            return Optional.empty();
        }
        return Optional.of(evaluate(ctx.value(), ctx.getBaseline(), riskLevel));
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.ENVIRONMENTAL;
    }

    public DetectorVerdict evaluate(double value, Baseline baseline, double riskLevel) {
        if (baseline == null || baseline.isInsufficientData()) {
            return DetectorVerdict.insufficientData(family(), "no usable baseline");
        }
        double deviation = DetectorUtils.deviationPercent(value, baseline.getMean(), EPSILON);
        double confidence = DetectorUtils.clamp01(Math.abs(deviation) / cfg.getSaturationPercent());
        String details = String.format(Locale.ROOT, "value=%.2f, riskLevel=%.2f, deviation=%.1f%%",
                value, riskLevel, deviation);

        boolean fired = value > riskLevel && deviation >= cfg.getMinDeviationPercent();
        if (!fired) {
            return DetectorVerdict.normal(family(), deviation, 0.0, details);
        }
        return DetectorVerdict.builder()
                .family(family())
                .anomalous(true)
                .score(deviation)
                .confidence(confidence)
                .firedMethod(DetectionMethod.ENVIRONMENTAL_THRESHOLD)
                .details(details)
                .build();
    }
}

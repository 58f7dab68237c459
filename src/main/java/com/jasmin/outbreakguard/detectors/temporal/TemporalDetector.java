package com.jasmin.outbreakguard.detectors.temporal;

import com.jasmin.outbreakguard.detectors.DetectionContext;
import com.jasmin.outbreakguard.detectors.Detector;
import com.jasmin.outbreakguard.detectors.DetectorUtils;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import com.jasmin.outbreakguard.models.MetricPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sustained directional change over the last few buckets, independent of the
 * absolute baseline. A single-bucket blip that reverts never fires.
 */
@Service
@Order(2)
@RequiredArgsConstructor
public class TemporalDetector implements Detector {

    private final TemporalProperties cfg;

    @Override
    public Optional<DetectorVerdict> detect(DetectionContext ctx) {
        if (!cfg.isEnabled()) {
            return Optional.empty();
        }
        List<Double> recent = new ArrayList<>();
        for (MetricPoint p : ctx.getHistory()) {
            recent.add(p.getValue());
        }
        recent.add(ctx.value());
        return Optional.of(evaluate(recent));
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.TEMPORAL;
    }

    /**
     * Evaluates the tail of {@code series} (oldest first, current value last).
     */
    public DetectorVerdict evaluate(List<Double> series) {
        int window = cfg.getWindowBuckets();
        if (series.size() < window) {
            return DetectorVerdict.insufficientData(family(),
                    "need " + window + " buckets, have " + series.size());
        }
        List<Double> tail = series.subList(series.size() - window, series.size());

        double[] rates = new double[window - 1];
        for (int i = 1; i < window; i++) {
            rates[i - 1] = DetectorUtils.rateOfChange(tail.get(i - 1), tail.get(i));
        }

        // Trailing run of qualifying changes sharing the direction of the latest one
        int run = 0;
        double magnitude = 0.0;
        double direction = Math.signum(rates[rates.length - 1]);
        for (int i = rates.length - 1; i >= 0; i--) {
            double r = rates[i];
            if (Double.isNaN(r) || Math.abs(r) <= cfg.getRateThresholdPercent() || Math.signum(r) != direction) {
                break;
            }
            run++;
            magnitude += Math.abs(r);
        }

        double latest = rates[rates.length - 1];
        String details = String.format(Locale.ROOT, "rates=%s, run=%d, threshold=%.1f%%",
                formatRates(rates), run, cfg.getRateThresholdPercent());

        if (run < cfg.getMinConsecutive()) {
            return DetectorVerdict.normal(family(), Double.isNaN(latest) ? 0.0 : latest, 0.0, details);
        }

        double meanRate = magnitude / run;
        double runFactor = (double) run / rates.length;
        double magnitudeFactor = DetectorUtils.clamp01(meanRate / (2.0 * cfg.getRateThresholdPercent()));
        double confidence = DetectorUtils.clamp01(0.5 * runFactor + 0.5 * magnitudeFactor);

        return DetectorVerdict.builder()
                .family(family())
                .anomalous(true)
                .score(direction * meanRate)
                .confidence(confidence)
                .firedMethod(DetectionMethod.RATE_OF_CHANGE)
                .details(details)
                .build();
    }

    private static String formatRates(double[] rates) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < rates.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Double.isNaN(rates[i]) ? "n/a" : String.format(Locale.ROOT, "%.1f%%", rates[i]));
        }
        return sb.append(']').toString();
    }
}

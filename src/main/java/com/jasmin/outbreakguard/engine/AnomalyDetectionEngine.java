package com.jasmin.outbreakguard.engine;

import com.jasmin.outbreakguard.baseline.BaselineCalculator;
import com.jasmin.outbreakguard.baseline.BaselineStore;
import com.jasmin.outbreakguard.detectors.DetectionContext;
import com.jasmin.outbreakguard.detectors.Detector;
import com.jasmin.outbreakguard.exceptions.InvalidReadingException;
import com.jasmin.outbreakguard.exceptions.ModelFitException;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DetectionReport;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import com.jasmin.outbreakguard.models.EvaluationWindow;
import com.jasmin.outbreakguard.models.KeyOutcome;
import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Entry point of a detection pass for one region and evaluation window.
 * <p>
 * Every tracked series of the region is snapshotted up front, then evaluated
 * on the detection pool with no shared mutable state. Verdicts are fused per
 * series by the {@link SeverityClassifier}, corroborated across sources by the
 * {@link CorrelationEngine} and returned most severe first. A failure in one
 * series never aborts the pass; it is reported as that series' outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionEngine {

    static final Comparator<Anomaly> REPORT_ORDER = Comparator
            .comparing(Anomaly::getSeverity, Comparator.reverseOrder())
            .thenComparing(Anomaly::getConfidence, Comparator.reverseOrder())
            .thenComparing(a -> a.getDataSource().code())
            .thenComparing(Anomaly::getMetric)
            .thenComparing(Anomaly::getId);

    private final BaselineStore baselineStore;
    private final List<Detector> detectors;
    private final SeverityClassifier classifier;
    private final CorrelationEngine correlationEngine;
    private final ExecutorService detectionExecutor;

    public List<Anomaly> detect(String region, EvaluationWindow window) {
        return evaluate(region, window).getAnomalies();
    }

    /** Records the supplied current readings, then runs the pass. */
    public List<Anomaly> detect(String region, EvaluationWindow window, List<ReadingVector> readings) {
        return evaluate(region, window, readings).getAnomalies();
    }

    public DetectionReport evaluate(String region, EvaluationWindow window) {
        return evaluate(region, window, List.of());
    }

    /**
     * Same as {@link #detect(String, EvaluationWindow, List)} but also reports
     * how each series ended, so "normal" and "could not tell" stay distinguishable.
     */
    public DetectionReport evaluate(String region, EvaluationWindow window, List<ReadingVector> readings) {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region must be provided");
        }
        if (window == null) {
            throw new IllegalArgumentException("evaluation window must be provided");
        }

        List<KeyOutcome> outcomes = new ArrayList<>(ingest(region, readings));

        List<DetectionContext> contexts = new ArrayList<>();
        for (SeriesKey key : baselineStore.trackedKeys(region)) {
            Optional<DetectionContext> ctx = snapshot(key, window);
            if (ctx.isPresent()) {
                contexts.add(ctx.get());
            } else {
                outcomes.add(KeyOutcome.of(key, KeyOutcome.Status.NO_DATA, "no reading inside " + describe(window)));
            }
        }

        List<Anomaly> candidates = new ArrayList<>();
        for (KeyResult r : fanOut(contexts)) {
            outcomes.add(r.outcome);
            if (r.anomaly != null) {
                candidates.add(r.anomaly);
            }
        }

        List<Anomaly> anomalies = new ArrayList<>(correlationEngine.correlate(window, candidates));
        anomalies.sort(REPORT_ORDER);

        long correlated = anomalies.stream().filter(a -> a.getCorrelationGroupId() != null).count();
        log.info("Detection pass for {} {}: {} series, {} anomalies ({} correlated)",
                region, describe(window), contexts.size(), anomalies.size(), correlated);
        return new DetectionReport(region, window, List.copyOf(anomalies), List.copyOf(outcomes));
    }

    private List<KeyOutcome> ingest(String region, List<ReadingVector> readings) {
        if (readings == null || readings.isEmpty()) {
            return List.of();
        }
        List<KeyOutcome> rejected = new ArrayList<>();
        for (ReadingVector r : readings) {
            SeriesKey key = r == null ? SeriesKey.of(region, null, null) : r.key();
            if (r != null && r.getRegion() != null && !region.equals(r.getRegion())) {
                log.warn("Rejecting reading for {}: region differs from requested {}", key, region);
                rejected.add(KeyOutcome.of(key, KeyOutcome.Status.INVALID_READING,
                        "reading belongs to region " + r.getRegion()));
                continue;
            }
            try {
                baselineStore.recordReading(r);
            } catch (InvalidReadingException e) {
                log.warn("Rejecting reading for {}: {}", key, e.getMessage());
                rejected.add(KeyOutcome.of(key, KeyOutcome.Status.INVALID_READING, e.getMessage()));
            }
        }
        return rejected;
    }

    /** Current reading is the newest point inside the window; history is everything before it. */
    private Optional<DetectionContext> snapshot(SeriesKey key, EvaluationWindow window) {
        List<MetricPoint> points = baselineStore.snapshot(key, window.getTo());
        int current = -1;
        for (int i = points.size() - 1; i >= 0; i--) {
            if (window.contains(points.get(i).getTimestamp())) {
                current = i;
                break;
            }
        }
        if (current < 0) {
            return Optional.empty();
        }
        List<MetricPoint> history = points.subList(0, current);
        Baseline baseline = BaselineCalculator.compute(history, baselineStore.minSamples());
        return Optional.of(DetectionContext.builder()
                .key(key)
                .reading(ReadingVector.fromPoint(key, points.get(current)))
                .baseline(baseline)
                .history(history)
                .seriesVersion(baselineStore.appendCount(key))
                .build());
    }

    private List<KeyResult> fanOut(List<DetectionContext> contexts) {
        List<Future<KeyResult>> futures = new ArrayList<>(contexts.size());
        for (DetectionContext ctx : contexts) {
            futures.add(detectionExecutor.submit(() -> evaluateKey(ctx)));
        }

        List<KeyResult> results = new ArrayList<>(contexts.size());
        for (int i = 0; i < futures.size(); i++) {
            SeriesKey key = contexts.get(i).getKey();
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Detection failed for {}", key, e.getCause());
                results.add(KeyResult.failed(key, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.get(i).cancel(true);
                log.error("Detection interrupted while waiting for {}", key);
                results.add(KeyResult.failed(key, "interrupted"));
            }
        }
        return results;
    }

    KeyResult evaluateKey(DetectionContext ctx) {
        SeriesKey key = ctx.getKey();
        Baseline baseline = ctx.getBaseline();
        if (baseline.isInsufficientData()) {
            return new KeyResult(KeyOutcome.of(key, KeyOutcome.Status.INSUFFICIENT_DATA,
                    "baseline has " + baseline.getSampleCount() + " samples, need " + baselineStore.minSamples()), null);
        }

        List<DetectorVerdict> verdicts = new ArrayList<>();
        Set<DetectorFamily> degraded = EnumSet.noneOf(DetectorFamily.class);
        for (Detector detector : detectors) {
            try {
                detector.detect(ctx).ifPresent(verdicts::add);
            } catch (ModelFitException e) {
                log.warn("Degrading {}: {} detector skipped ({})", key, detector.family(), e.getMessage());
                degraded.add(detector.family());
            }
        }

        Anomaly anomaly = classifier.classify(key, ctx.getReading(), baseline, verdicts, degraded).orElse(null);
        String details = anomaly == null ? "normal" : anomaly.getSeverity().code() + " " + anomaly.getAnomalyType().code();
        if (!degraded.isEmpty()) {
            return new KeyResult(KeyOutcome.of(key, KeyOutcome.Status.DEGRADED, details + ", skipped " + degraded), anomaly);
        }
        return new KeyResult(KeyOutcome.of(key, KeyOutcome.Status.EVALUATED, details), anomaly);
    }

    private static String describe(EvaluationWindow window) {
        return "[" + window.getFrom() + " .. " + window.getTo() + "]";
    }

    static final class KeyResult {
        final KeyOutcome outcome;
        final Anomaly anomaly;

        KeyResult(KeyOutcome outcome, Anomaly anomaly) {
            this.outcome = outcome;
            this.anomaly = anomaly;
        }

        static KeyResult failed(SeriesKey key, String details) {
            return new KeyResult(KeyOutcome.of(key, KeyOutcome.Status.FAILED, details), null);
        }
    }
}

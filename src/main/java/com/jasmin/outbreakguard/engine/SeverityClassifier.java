package com.jasmin.outbreakguard.engine;

import com.jasmin.outbreakguard.constants.Constants;
import com.jasmin.outbreakguard.detectors.DetectorUtils;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.AnomalyType;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import com.jasmin.outbreakguard.models.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Fuses the verdicts of one series into at most one anomaly candidate. Each
 * firing test counts as one vote; insufficient_data verdicts never vote.
 */
@Component
@RequiredArgsConstructor
public class SeverityClassifier {

    private static final double EPSILON = 1e-9;

    private final EngineProperties cfg;

    /**
     * @param degraded detector families that could not run for this key
     * @return empty when no verdict is anomalous
     */
    public Optional<Anomaly> classify(SeriesKey key, ReadingVector reading, Baseline baseline,
                                      List<DetectorVerdict> verdicts, Set<DetectorFamily> degraded) {
        Set<DetectionMethod> fired = EnumSet.noneOf(DetectionMethod.class);
        Set<DetectorFamily> firingFamilies = EnumSet.noneOf(DetectorFamily.class);
        double confidence = 0.0;
        for (DetectorVerdict v : verdicts) {
            if (!v.votes()) continue;
            fired.addAll(v.getFiredMethods());
            firingFamilies.add(v.getFamily());
            confidence = Math.max(confidence, v.getConfidence());
        }
        if (fired.isEmpty()) {
            return Optional.empty();
        }

        double current = reading.getValue();
        double mean = baseline.getMean();

        Anomaly.AnomalyBuilder b = Anomaly.builder()
                .id(anomalyId(key, reading))
                .timestamp(reading.getTimestamp())
                .region(key.getRegion())
                .dataSource(key.getSource())
                .metric(key.getMetric())
                .anomalyType(typeOf(key.getSource(), firingFamilies, current, mean))
                .severity(severity(fired.size(), confidence))
                .confidence(confidence)
                .baselineValue(mean)
                .currentValue(current)
                .deviationPercent(DetectorUtils.deviationPercent(current, mean, EPSILON))
                .detectionMethods(fired)
                .metadataEntry(Constants.META_SAMPLE_COUNT, baseline.getSampleCount())
                .metadataEntry(Constants.META_STD_DEV, baseline.getStdDev());

        for (DetectorVerdict v : verdicts) {
            if (v.getDetails() != null) {
                b.metadataEntry(v.getFamily().name().toLowerCase(Locale.ROOT), v.getDetails());
            }
        }
        if (reading.getCompanionMetrics() != null && !reading.getCompanionMetrics().isEmpty()) {
            b.metadataEntry(Constants.META_COMPANIONS, new TreeMap<>(reading.getCompanionMetrics()));
        }
        if (!degraded.isEmpty()) {
            b.metadataEntry(Constants.META_DEGRADED, degraded.stream().map(Enum::name).toList());
        }
        return Optional.of(b.build());
    }

    /** Ordered thresholds on agreeing methods and the strongest firing confidence. */
    public Severity severity(int firingMethods, double confidence) {
        EngineProperties.SeverityThresholds t = cfg.getSeverity();
        boolean agree = firingMethods >= t.getAgreeingMethods();
        if (agree && confidence >= t.getCritical()) {
            return Severity.CRITICAL;
        }
        if (agree || confidence >= t.getHigh()) {
            return Severity.HIGH;
        }
        return confidence >= t.getMedium() ? Severity.MEDIUM : Severity.LOW;
    }

    public AnomalyType typeOf(DataSource source, Set<DetectorFamily> firingFamilies, double current, double mean) {
        if (firingFamilies.size() == 1 && firingFamilies.contains(DetectorFamily.TEMPORAL)) {
            return AnomalyType.TREND;
        }
        if (source == DataSource.ENVIRONMENTAL) {
            return AnomalyType.ENVIRONMENTAL;
        }
        return current < mean ? AnomalyType.DROP : AnomalyType.SPIKE;
    }

    /** Name-based id, so the same reading always yields the same anomaly id. */
    static String anomalyId(SeriesKey key, ReadingVector reading) {
        String seed = key + "|" + reading.getTimestamp();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}

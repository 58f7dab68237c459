package com.jasmin.outbreakguard.engine;

import com.jasmin.outbreakguard.baseline.BaselineProperties;
import com.jasmin.outbreakguard.baseline.BaselineStore;
import com.jasmin.outbreakguard.baseline.InMemoryMetricSeriesRepository;
import com.jasmin.outbreakguard.constants.Constants;
import com.jasmin.outbreakguard.detectors.DetectionContext;
import com.jasmin.outbreakguard.detectors.Detector;
import com.jasmin.outbreakguard.detectors.environmental.EnvironmentalDetector;
import com.jasmin.outbreakguard.detectors.environmental.EnvironmentalProperties;
import com.jasmin.outbreakguard.detectors.ml.MlDetector;
import com.jasmin.outbreakguard.detectors.ml.MlDetectorProperties;
import com.jasmin.outbreakguard.detectors.statistical.StatisticalDetector;
import com.jasmin.outbreakguard.detectors.statistical.StatisticalProperties;
import com.jasmin.outbreakguard.detectors.temporal.TemporalDetector;
import com.jasmin.outbreakguard.detectors.temporal.TemporalProperties;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.AnomalyType;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectionReport;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import com.jasmin.outbreakguard.models.EvaluationWindow;
import com.jasmin.outbreakguard.models.KeyOutcome;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import com.jasmin.outbreakguard.models.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectionEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant NOW = hour(20);
    private static final EvaluationWindow WINDOW = EvaluationWindow.endingAt(NOW, Duration.ofMinutes(30));

    private ExecutorService executor;
    private BaselineStore store;
    private List<Detector> detectors;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        store = new BaselineStore(new InMemoryMetricSeriesRepository(), new BaselineProperties());
        detectors = new ArrayList<>(List.of(
                new StatisticalDetector(new StatisticalProperties()),
                new TemporalDetector(new TemporalProperties()),
                new MlDetector(new MlDetectorProperties()),
                new EnvironmentalDetector(new EnvironmentalProperties())));
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void hospitalSpikeIsCritical() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 45, NOW);

        List<Anomaly> anomalies = engine.detect("north", WINDOW);

        assertThat(anomalies).hasSize(1);
        Anomaly a = anomalies.get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(a.getDeviationPercent()).isCloseTo(200.0, within(1e-9));
        assertThat(a.getBaselineValue()).isCloseTo(15.0, within(1e-9));
        assertThat(a.getDetectionMethods()).contains(DetectionMethod.Z_SCORE, DetectionMethod.IQR);
        assertThat(a.getConfidence()).isGreaterThanOrEqualTo(0.8);
        assertThat(a.getCorrelationGroupId()).isNull();
    }

    @Test
    void hospitalAndSocialSpikesInOneRegionAreCorrelated() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        seedAlternating("north", DataSource.SOCIAL_MEDIA, Constants.MENTION_COUNT, 77, 97, 20);
        List<ReadingVector> current = List.of(
                reading("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 45, NOW),
                reading("north", DataSource.SOCIAL_MEDIA, Constants.MENTION_COUNT, 247, NOW));

        List<Anomaly> anomalies = engine.detect("north", WINDOW, current);

        assertThat(anomalies).hasSize(2);
        assertThat(anomalies).extracting(Anomaly::getDataSource)
                .containsExactly(DataSource.HOSPITAL, DataSource.SOCIAL_MEDIA);
        assertThat(anomalies.get(0).getCorrelationGroupId()).isNotNull()
                .isEqualTo(anomalies.get(1).getCorrelationGroupId());
        assertThat(anomalies).allSatisfy(a -> {
            assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(a.getMetadata().get(Constants.META_CORRELATED_SOURCES))
                    .isEqualTo(List.of("hospital", "social_media"));
        });
        assertThat(anomalies.get(1).getBaselineValue()).isCloseTo(87.0, within(1e-9));
    }

    @Test
    void shortHistoryYieldsNoAnomaly() {
        for (int i = 15; i < 20; i++) {
            record("east", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10 + i % 2, hour(i));
        }
        record("east", DataSource.HOSPITAL, Constants.VISIT_COUNT, 500, NOW);

        DetectionReport report = engine.evaluate("east", WINDOW);

        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus)
                .containsExactly(KeyOutcome.Status.INSUFFICIENT_DATA);
    }

    @Test
    void modestAirQualityRiseAboveRiskLevelIsMedium() {
        double[] history = {150, 155, 160, 165, 170, 175, 175, 175, 175, 180, 185, 190, 195, 200};
        for (int i = 0; i < history.length; i++) {
            record("west", DataSource.ENVIRONMENTAL, Constants.AIR_QUALITY_INDEX, history[i], hour(6 + i));
        }
        record("west", DataSource.ENVIRONMENTAL, Constants.AIR_QUALITY_INDEX, 202, NOW);

        List<Anomaly> anomalies = engine.detect("west", WINDOW);

        assertThat(anomalies).hasSize(1);
        Anomaly a = anomalies.get(0);
        assertThat(a.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.ENVIRONMENTAL);
        assertThat(a.getDetectionMethods()).containsExactly(DetectionMethod.ENVIRONMENTAL_THRESHOLD);
        assertThat(a.getBaselineValue()).isCloseTo(175.0, within(1e-9));
        assertThat(a.getDeviationPercent()).isCloseTo(15.43, within(0.01));
    }

    @Test
    void repeatedDetectionIsIdentical() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        seedAlternating("north", DataSource.SOCIAL_MEDIA, Constants.MENTION_COUNT, 77, 97, 20);
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 45, NOW);
        record("north", DataSource.SOCIAL_MEDIA, Constants.MENTION_COUNT, 247, NOW);

        assertThat(engine.detect("north", WINDOW)).isEqualTo(engine.detect("north", WINDOW));
    }

    @Test
    void modelVerdictsDoNotDependOnEarlierPasses() {
        seedWithCompanions("north", 60, 30);
        EvaluationWindow early = EvaluationWindow.endingAt(hour(30), Duration.ofMinutes(30));
        EvaluationWindow late = EvaluationWindow.endingAt(hour(59), Duration.ofMinutes(30));

        List<Anomaly> earlyFresh = engineWithFreshDetectors().detect("north", early);
        List<Anomaly> lateFresh = engineWithFreshDetectors().detect("north", late);

        AnomalyDetectionEngine reused = engineWithFreshDetectors();
        List<Anomaly> lateFirst = reused.detect("north", late);
        List<Anomaly> earlyAfterLate = reused.detect("north", early);
        List<Anomaly> lateAgain = reused.detect("north", late);

        assertThat(earlyAfterLate).isEqualTo(earlyFresh);
        assertThat(lateFirst).isEqualTo(lateFresh);
        assertThat(lateAgain).isEqualTo(lateFresh);
        assertThat(earlyFresh).singleElement().satisfies(a -> {
            assertThat(a.getDetectionMethods()).contains(DetectionMethod.ISOLATION_FOREST, DetectionMethod.Z_SCORE);
            assertThat((String) a.getMetadata().get("ml")).contains("trainingRows=20");
        });
    }

    @Test
    void sustainedRiseInsideNormalRangeIsTrend() {
        // Wide alternating baseline, then 10 -> 16 -> 26: two +60% buckets, none extreme
        for (int i = 0; i < 18; i++) {
            record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, i % 2 == 0 ? 40 : 10, hour(i));
        }
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, hour(18));
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 16, hour(19));
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 26, NOW);

        List<Anomaly> anomalies = engine.detect("north", WINDOW);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.TREND);
            assertThat(a.getDetectionMethods()).containsExactly(DetectionMethod.RATE_OF_CHANGE);
            assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
        });
    }

    @Test
    void missingCompanionMetricsOnlySkipTheModel() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        store.recordReading(ReadingVector.builder()
                .region("north").dataSource(DataSource.HOSPITAL).metric(Constants.VISIT_COUNT)
                .value(45.0).timestamp(NOW)
                .companionMetrics(Map.of("respiratory_visits", 30.0))
                .build());

        DetectionReport report = engine.evaluate("north", WINDOW);

        assertThat(report.getAnomalies()).hasSize(1);
        assertThat(report.getAnomalies().get(0).getDetectionMethods()).doesNotContain(DetectionMethod.ISOLATION_FOREST);
        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus).containsExactly(KeyOutcome.Status.EVALUATED);
    }

    @Test
    void unfittableModelDegradesToOtherDetectors() {
        Map<String, Double> companions = Map.of("respiratory_visits", 3.0, "fever_visits", 2.0);
        for (int i = 0; i < 25; i++) {
            store.recordReading(new ReadingVector("south", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10.0,
                    NOW.minus(Duration.ofHours(25 - i)), companions));
        }
        store.recordReading(new ReadingVector("south", DataSource.HOSPITAL, Constants.VISIT_COUNT, 30.0, NOW, companions));

        DetectionReport report = engine.evaluate("south", WINDOW);

        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus).containsExactly(KeyOutcome.Status.DEGRADED);
        assertThat(report.getAnomalies()).hasSize(1);
        Anomaly a = report.getAnomalies().get(0);
        assertThat(a.getDetectionMethods()).contains(DetectionMethod.Z_SCORE);
        assertThat(a.getMetadata().get(Constants.META_DEGRADED)).isEqualTo(List.of("ML"));
    }

    @Test
    void failureInOneSeriesIsIsolated() {
        detectors.add(new Detector() {
            @Override
            public Optional<DetectorVerdict> detect(DetectionContext ctx) {
                if (ctx.getKey().getSource() == DataSource.PHARMACY) {
                    throw new IllegalStateException("boom");
                }
                return Optional.empty();
            }

            @Override
            public DetectorFamily family() {
                return DetectorFamily.STATISTICAL;
            }
        });
        engine = newEngine();
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        seedAlternating("north", DataSource.PHARMACY, Constants.PRESCRIPTION_COUNT, 40, 50, 20);
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 45, NOW);
        record("north", DataSource.PHARMACY, Constants.PRESCRIPTION_COUNT, 48, NOW);

        DetectionReport report = engine.evaluate("north", WINDOW);

        assertThat(report.getAnomalies()).extracting(Anomaly::getDataSource).containsExactly(DataSource.HOSPITAL);
        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus)
                .containsExactly(KeyOutcome.Status.EVALUATED, KeyOutcome.Status.FAILED);
    }

    @Test
    void invalidSuppliedReadingsAreReportedNotThrown() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        ReadingVector missingValue = ReadingVector.builder()
                .region("north").dataSource(DataSource.PHARMACY).metric(Constants.PRESCRIPTION_COUNT)
                .timestamp(NOW).build();
        ReadingVector otherRegion = reading("south", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, NOW);

        DetectionReport report = engine.evaluate("north", WINDOW, List.of(missingValue, otherRegion,
                reading("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 45, NOW)));

        assertThat(report.getAnomalies()).hasSize(1);
        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus).containsExactly(
                KeyOutcome.Status.INVALID_READING, KeyOutcome.Status.INVALID_READING, KeyOutcome.Status.EVALUATED);
        assertThat(store.trackedKeys("south")).isEmpty();
    }

    @Test
    void seriesWithoutReadingInWindowIsNoData() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);

        DetectionReport report = engine.evaluate("north", WINDOW);

        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(KeyOutcome.Status.NO_DATA);
            assertThat(o.getKey()).isEqualTo(SeriesKey.of("north", DataSource.HOSPITAL, Constants.VISIT_COUNT));
        });
    }

    @Test
    void normalReadingIsEvaluatedWithoutAnomaly() {
        seedAlternating("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 10, 20, 20);
        record("north", DataSource.HOSPITAL, Constants.VISIT_COUNT, 16, NOW);

        DetectionReport report = engine.evaluate("north", WINDOW);

        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getOutcomes()).extracting(KeyOutcome::getStatus).containsExactly(KeyOutcome.Status.EVALUATED);
    }

    @Test
    void blankRegionIsRejected() {
        assertThatThrownBy(() -> engine.detect(" ", WINDOW)).isInstanceOf(IllegalArgumentException.class);
    }

    private AnomalyDetectionEngine newEngine() {
        EngineProperties props = new EngineProperties();
        return new AnomalyDetectionEngine(store, detectors, new SeverityClassifier(props),
                new CorrelationEngine(props), executor);
    }

    private AnomalyDetectionEngine engineWithFreshDetectors() {
        List<Detector> fresh = List.of(
                new StatisticalDetector(new StatisticalProperties()),
                new TemporalDetector(new TemporalProperties()),
                new MlDetector(new MlDetectorProperties()),
                new EnvironmentalDetector(new EnvironmentalProperties()));
        EngineProperties props = new EngineProperties();
        return new AnomalyDetectionEngine(store, fresh, new SeverityClassifier(props),
                new CorrelationEngine(props), executor);
    }

    /** {@code n} hourly hospital points from hour 0 with companions; one far outlier at {@code outlierHour}. */
    private void seedWithCompanions(String region, int n, int outlierHour) {
        for (int i = 0; i < n; i++) {
            boolean outlier = i == outlierHour;
            double value = outlier ? 300 : 100 + (i * 7 % 11) * 0.5;
            Map<String, Double> companions = outlier
                    ? Map.of("respiratory_visits", 200.0, "fever_visits", 150.0)
                    : Map.of("respiratory_visits", 20.0 + (i * 3 % 7), "fever_visits", 8 + (i * 2 % 5) + i * 0.01);
            store.recordReading(new ReadingVector(region, DataSource.HOSPITAL, Constants.VISIT_COUNT, value, hour(i), companions));
        }
    }

    /** {@code n} hourly points ending one hour before NOW, alternating a, b and ending on b. */
    private void seedAlternating(String region, DataSource source, String metric, double a, double b, int n) {
        for (int i = 0; i < n; i++) {
            record(region, source, metric, (n - i) % 2 == 0 ? a : b, NOW.minus(Duration.ofHours(n - i)));
        }
    }

    private void record(String region, DataSource source, String metric, double value, Instant ts) {
        store.recordReading(region, source, metric, value, ts);
    }

    private static ReadingVector reading(String region, DataSource source, String metric, double value, Instant ts) {
        return new ReadingVector(region, source, metric, value, ts, null);
    }

    private static Instant hour(int h) {
        return T0.plus(Duration.ofHours(h));
    }
}

package com.jasmin.outbreakguard.detectors.ml;

import com.jasmin.outbreakguard.baseline.BaselineCalculator;
import com.jasmin.outbreakguard.detectors.DetectionContext;
import com.jasmin.outbreakguard.detectors.Detector;
import com.jasmin.outbreakguard.detectors.DetectorUtils;
import com.jasmin.outbreakguard.exceptions.ModelFitException;
import com.jasmin.outbreakguard.models.DetectionMethod;
import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;
import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Multivariate outlier scoring with an isolation forest over the reading's
 * feature vector (metric value + configured companion metrics).
 * <p>
 * The scaler and forest are fitted on history only, never on the live point.
 * Training uses the leading rows of the history up to the last refit boundary,
 * so the fitted model is a function of the history alone: it changes only after
 * more than {@code refitDelta} new training rows, and an earlier window never
 * sees a model trained on later points. The last fit per series is cached,
 * failed fits included.
 */
@Slf4j
@Service
@Order(3)
@RequiredArgsConstructor
public class MlDetector implements Detector {

    private final MlDetectorProperties cfg;

    private final Map<SeriesKey, CachedFit> models = new ConcurrentHashMap<>();

    @Override
    public Optional<DetectorVerdict> detect(DetectionContext ctx) {
        if (!cfg.isEnabled()) {
            return Optional.empty();
        }
        List<String> features = cfg.featureSet(ctx.getKey().getMetric());
        if (features.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Double> companions = ctx.getReading().getCompanionMetrics();
        if (companions == null || !companions.keySet().containsAll(features)) {
            log.debug("Skipping ML for {}: reading lacks companion metrics {}", ctx.getKey(), features);
            return Optional.empty();
        }

        List<double[]> rows = new ArrayList<>();
        for (MetricPoint p : ctx.getHistory()) {
            if (p.getCompanions().keySet().containsAll(features)) {
                rows.add(vector(p.getValue(), p.getCompanions(), features));
            }
        }
        if (rows.size() < cfg.getMinTrainingSamples()) {
            return Optional.of(DetectorVerdict.insufficientData(family(),
                    "training rows " + rows.size() + " < " + cfg.getMinTrainingSamples()));
        }

        FittedModel model = modelFor(ctx.getKey(), features, rows.toArray(new double[0][]), ctx.getSeriesVersion());
        double[] live = model.scaler.transform(vector(ctx.value(), companions, features));
        double score = model.forest.score(live);
        boolean anomalous = score > model.threshold;
        double span = model.maxScore - model.minScore;
        double confidence = span > 0.0
                ? DetectorUtils.clamp01((score - model.minScore) / span)
                : (anomalous ? 1.0 : 0.0);

        String details = String.format(Locale.ROOT, "isolationScore=%.3f, threshold=%.3f, trainingRows=%d",
                score, model.threshold, model.trainingRows);
        if (!anomalous) {
            return Optional.of(DetectorVerdict.normal(family(), score, confidence, details));
        }
        return Optional.of(DetectorVerdict.builder()
                .family(family())
                .anomalous(true)
                .score(score)
                .confidence(confidence)
                .firedMethod(DetectionMethod.ISOLATION_FOREST)
                .details(details)
                .build());
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.ML;
    }

    /** Drops cached models, e.g. after a configuration change. */
    public void evictModels() {
        models.clear();
    }

    /**
     * Returns the model for the training prefix of {@code rows}, fitting it only
     * when the cached fit for the series was made on different rows.
     *
     * @throws ModelFitException when the prefix cannot be fitted; cached like a model
     */
    FittedModel modelFor(SeriesKey key, List<String> features, double[][] rows, long version) {
        double[][] training = Arrays.copyOf(rows, trainingPrefix(rows.length));
        CachedFit cached = models.compute(key, (k, existing) -> {
            if (existing != null && existing.fittedOn(features, training)) {
                return existing;
            }
            try {
                FittedModel fitted = fit(k, features, training, version);
                log.debug("Fitted isolation forest for {} on {} rows (version {})", k, training.length, version);
                return new CachedFit(List.copyOf(features), training, fitted, null);
            } catch (ModelFitException e) {
                return new CachedFit(List.copyOf(features), training, null, e);
            }
        });
        if (cached.failure != null) {
            throw cached.failure;
        }
        return cached.model;
    }

    /** Rows up to the last boundary: min-training-samples, then every refitDelta + 1 rows. */
    int trainingPrefix(int available) {
        int min = cfg.getMinTrainingSamples();
        if (available <= min) {
            return available;
        }
        int step = cfg.getRefitDelta() + 1;
        return min + (available - min) / step * step;
    }

    /**
     * @throws ModelFitException when every feature is constant over the training rows
     */
    FittedModel fit(SeriesKey key, List<String> features, double[][] rows, long version) {
        FeatureScaler scaler = FeatureScaler.fit(rows);
        if (scaler.isDegenerate()) {
            throw new ModelFitException(key, "all " + rows.length + " training rows are identical");
        }
        double[][] scaled = scaler.transform(rows);
        IsolationForest forest = IsolationForest.fit(scaled, cfg.getNumTrees(), cfg.getSampleSize(), cfg.getSeed());

        double[] trainingScores = new double[scaled.length];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < scaled.length; i++) {
            trainingScores[i] = forest.score(scaled[i]);
            min = Math.min(min, trainingScores[i]);
            max = Math.max(max, trainingScores[i]);
        }
        double threshold = BaselineCalculator.percentile(trainingScores, (1.0 - cfg.getContamination()) * 100.0);
        return new FittedModel(List.copyOf(features), scaler, forest, threshold, min, max, scaled.length, version);
    }

    private static double[] vector(double value, Map<String, Double> companions, List<String> features) {
        double[] v = new double[features.size() + 1];
        v[0] = value;
        for (int i = 0; i < features.size(); i++) {
            v[i + 1] = companions.get(features.get(i));
        }
        return v;
    }

    static final class CachedFit {
        final List<String> features;
        final double[][] training;
        final FittedModel model;
        final ModelFitException failure;

        CachedFit(List<String> features, double[][] training, FittedModel model, ModelFitException failure) {
            this.features = features;
            this.training = training;
            this.model = model;
            this.failure = failure;
        }

        boolean fittedOn(List<String> otherFeatures, double[][] otherTraining) {
            return features.equals(otherFeatures) && Arrays.deepEquals(training, otherTraining);
        }
    }

    static final class FittedModel {
        final List<String> features;
        final FeatureScaler scaler;
        final IsolationForest forest;
        final double threshold;
        final double minScore;
        final double maxScore;
        final int trainingRows;
        final long fittedAtVersion;

        FittedModel(List<String> features, FeatureScaler scaler, IsolationForest forest, double threshold,
                    double minScore, double maxScore, int trainingRows, long fittedAtVersion) {
            this.features = features;
            this.scaler = scaler;
            this.forest = forest;
            this.threshold = threshold;
            this.minScore = minScore;
            this.maxScore = maxScore;
            this.trainingRows = trainingRows;
            this.fittedAtVersion = fittedAtVersion;
        }
    }
}

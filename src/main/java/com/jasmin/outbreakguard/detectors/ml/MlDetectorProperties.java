package com.jasmin.outbreakguard.detectors.ml;

import com.jasmin.outbreakguard.constants.Constants;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.ml")
public class MlDetectorProperties {

    private boolean enabled = true;

    /** Number of isolation trees. */
    @Min(1) private int numTrees = 100;

    /** Sub-sample size per tree (capped at the training size). */
    @Min(2) private int sampleSize = 256;

    /** Seed for model fitting; fixed so verdicts are reproducible. */
    private long seed = 42L;

    /** Expected fraction of outliers in the training window; sets the decision threshold. */
    @DecimalMin("0.001") @DecimalMax("0.5") private double contamination = 0.10;

    /** Training rows (history points carrying every feature) needed before the model is fitted. */
    @Min(2) private int minTrainingSamples = 20;

    /** Refit once more than this many training rows have accrued past the last fitted prefix. */
    @Min(0) private int refitDelta = 24;

    /**
     * Companion features per metric, in vector order after the metric's own value.
     * Metrics not listed here are not scored by the model.
     */
    private Map<String, List<String>> featureSets = defaultFeatureSets();

    public List<String> featureSet(String metric) {
        List<String> fs = featureSets.get(metric);
        return fs == null ? List.of() : fs;
    }

    private static Map<String, List<String>> defaultFeatureSets() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(Constants.VISIT_COUNT, new ArrayList<>(List.of("respiratory_visits", "fever_visits")));
        m.put(Constants.MENTION_COUNT, new ArrayList<>(List.of("sentiment_score", "unique_authors")));
        m.put(Constants.AIR_QUALITY_INDEX, new ArrayList<>(List.of("temperature", "humidity")));
        m.put(Constants.PRESCRIPTION_COUNT, new ArrayList<>(List.of("otc_sales", "antipyretic_sales")));
        return m;
    }
}

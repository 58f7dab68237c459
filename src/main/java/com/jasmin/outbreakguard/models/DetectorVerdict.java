package com.jasmin.outbreakguard.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one detector for one reading. Consumed immediately by the severity
 * classifier. {@code insufficientData} verdicts never vote and are always
 * non-anomalous, which keeps "unknown" distinguishable from "normal".
 */
@Value
@Builder
public class DetectorVerdict {
    DetectorFamily family;
    boolean anomalous;
    boolean insufficientData;

    /** Method-specific raw statistic (z, rate of change, isolation score...). */
    double score;

    /** Normalized confidence in [0, 1]. */
    double confidence;

    @Singular("firedMethod")
    List<DetectionMethod> firedMethods;

    String details;

    public static DetectorVerdict insufficientData(DetectorFamily family, String details) {
        return DetectorVerdict.builder()
                .family(family)
                .insufficientData(true)
                .details(details)
                .build();
    }

    public static DetectorVerdict normal(DetectorFamily family, double score, double confidence, String details) {
        return DetectorVerdict.builder()
                .family(family)
                .score(score)
                .confidence(confidence)
                .details(details)
                .build();
    }

    /** True when this verdict takes part in the severity vote. */
    public boolean votes() {
        return anomalous && !insufficientData;
    }
}

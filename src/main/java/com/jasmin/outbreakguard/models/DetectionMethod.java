package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Individual test that can fire inside a detector. Each counts as one
 * independent method when severity is assigned.
 */
public enum DetectionMethod {
    Z_SCORE(DetectorFamily.STATISTICAL, "z_score"),
    IQR(DetectorFamily.STATISTICAL, "iqr"),
    MODIFIED_Z_SCORE(DetectorFamily.STATISTICAL, "modified_z_score"),
    RATE_OF_CHANGE(DetectorFamily.TEMPORAL, "rate_of_change"),
    ISOLATION_FOREST(DetectorFamily.ML, "isolation_forest"),
    ENVIRONMENTAL_THRESHOLD(DetectorFamily.ENVIRONMENTAL, "environmental_threshold");

    private final DetectorFamily family;
    private final String code;

    DetectionMethod(DetectorFamily family, String code) {
        this.family = family;
        this.code = code;
    }

    public DetectorFamily family() {
        return family;
    }

    @JsonValue
    public String code() {
        return code;
    }
}

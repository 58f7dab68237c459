package com.jasmin.outbreakguard.constants;

public class Constants {
    // Metric names with a built-in feature set / health-risk level
    public static final String VISIT_COUNT = "visit_count";
    public static final String MENTION_COUNT = "mention_count";
    public static final String AIR_QUALITY_INDEX = "air_quality_index";
    public static final String PRESCRIPTION_COUNT = "prescription_count";

    // Anomaly metadata keys
    public static final String META_SAMPLE_COUNT = "baseline_sample_count";
    public static final String META_STD_DEV = "baseline_std_dev";
    public static final String META_DEGRADED = "degraded_detectors";
    public static final String META_CORRELATED_SOURCES = "correlated_sources";
    public static final String META_COMPANIONS = "companion_metrics";
    public static final String META_PRE_CORRELATION_SEVERITY = "pre_correlation_severity";

    private Constants() {
    }
}

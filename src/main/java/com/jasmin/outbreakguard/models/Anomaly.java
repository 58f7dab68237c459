package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The unit of output of one detection pass. Immutable once emitted; the
 * correlation step derives modified copies through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Anomaly {
    String id;
    Instant timestamp;
    String region;
    DataSource dataSource;
    String metric;
    AnomalyType anomalyType;
    Severity severity;
    double confidence;
    double baselineValue;
    double currentValue;
    double deviationPercent;

    /** Every method that fired, serialized under its wire name {@code detection_method}. */
    @JsonProperty("detection_method")
    @Singular("detectionMethod")
    List<DetectionMethod> detectionMethods;

    /** Null unless corroborated by another source in the same region and window. */
    String correlationGroupId;

    @Singular("metadataEntry")
    Map<String, Object> metadata;
}

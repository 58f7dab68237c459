package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One stored observation of a series: aggregated value at a timestamp plus the
 * companion metrics that arrived with it (may be empty).
 */
@Value
public class MetricPoint {
    Instant timestamp;
    double value;
    Map<String, Double> companions;

    @JsonCreator
    public MetricPoint(@JsonProperty("timestamp") Instant timestamp,
                       @JsonProperty("value") double value,
                       @JsonProperty("companions") Map<String, Double> companions) {
        this.timestamp = timestamp;
        this.value = value;
        this.companions = (companions == null || companions.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(companions));
    }

    public static MetricPoint of(Instant timestamp, double value) {
        return new MetricPoint(timestamp, value, null);
    }
}

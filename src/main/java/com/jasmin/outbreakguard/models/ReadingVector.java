package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One current observation as handed over by the ingestion collaborator.
 * Values are already aggregated per period (e.g. fever visits per hospital per hour).
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReadingVector {
    private String region;
    private DataSource dataSource;
    private String metric;
    private Double value;
    private Instant timestamp;

    // Optional multivariate context: feature name -> value
    private Map<String, Double> companionMetrics;

    public SeriesKey key() {
        return SeriesKey.of(region, dataSource, metric);
    }

    public MetricPoint toPoint() {
        return new MetricPoint(timestamp, value, companionMetrics);
    }

    public static ReadingVector fromPoint(SeriesKey key, MetricPoint point) {
        return new ReadingVector(key.getRegion(), key.getSource(), key.getMetric(),
                point.getValue(), point.getTimestamp(), point.getCompanions());
    }
}

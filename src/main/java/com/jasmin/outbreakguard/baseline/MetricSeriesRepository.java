package com.jasmin.outbreakguard.baseline;

import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.SeriesKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage backend for metric series. Implementations need not be safe for
 * concurrent writers on the same key: {@link BaselineStore} serializes them.
 */
public interface MetricSeriesRepository {

    /** All stored points of the series, oldest first. Never null. */
    List<MetricPoint> load(SeriesKey key);

    Optional<Instant> latestTimestamp(SeriesKey key);

    /** Stores the point, replacing any point with the same timestamp. */
    void upsert(SeriesKey key, MetricPoint point);

    /** Removes points strictly older than {@code floor}; returns how many went. */
    int evictBefore(SeriesKey key, Instant floor);

    Set<SeriesKey> keys(String region);

    /** Number of upserts ever applied to the series; only grows. */
    long appendCount(SeriesKey key);
}

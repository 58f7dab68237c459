package com.jasmin.outbreakguard.baseline;

import com.jasmin.outbreakguard.exceptions.InsufficientDataException;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of every metric series. Writes are serialized per series key; all
 * read paths hand out immutable snapshots, so detectors never touch storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineStore {

    private final MetricSeriesRepository repository;
    private final BaselineProperties props;

    private final Map<SeriesKey, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    /**
     * Appends a scalar reading.
     *
     * @return false when the reading was older than the retention floor and dropped
     */
    public boolean recordReading(String region, DataSource source, String metric, double value, Instant timestamp) {
        return recordReading(new ReadingVector(region, source, metric, value, timestamp, null));
    }

    /**
     * Appends a reading together with its companion metrics, then evicts points
     * that fell out of the retention window.
     *
     * @return false when the reading was older than the retention floor and dropped
     * @throws com.jasmin.outbreakguard.exceptions.InvalidReadingException when required fields are missing
     */
    public boolean recordReading(ReadingVector reading) {
        ReadingValidator.validate(reading);
        SeriesKey key = reading.key();
        Instant ts = reading.getTimestamp();
        Duration retention = props.retention();

        ReentrantLock lock = writeLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<Instant> latest = repository.latestTimestamp(key);
            if (latest.isPresent() && ts.isBefore(latest.get().minus(retention))) {
                log.warn("Dropping reading for {} at {}: older than retention floor {}",
                        key, ts, latest.get().minus(retention));
                return false;
            }

            repository.upsert(key, reading.toPoint());

            Instant newest = latest.filter(l -> l.isAfter(ts)).orElse(ts);
            int evicted = repository.evictBefore(key, newest.minus(retention));
            if (evicted > 0) {
                log.debug("Evicted {} points from {} older than {}", evicted, key, newest.minus(retention));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Baseline getBaseline(String region, DataSource source, String metric, Instant asOf) {
        return getBaseline(SeriesKey.of(region, source, metric), asOf);
    }

    /** Baseline over points with timestamp <= asOf inside the retention window. */
    public Baseline getBaseline(SeriesKey key, Instant asOf) {
        return BaselineCalculator.compute(snapshot(key, asOf), props.getMinSamples());
    }

    /**
     * Same as {@link #getBaseline(SeriesKey, Instant)} but refuses to hand out an unusable baseline.
     *
     * @throws InsufficientDataException when the sample count is below the minimum
     */
    public Baseline requireBaseline(SeriesKey key, Instant asOf) {
        Baseline b = getBaseline(key, asOf);
        if (b.isInsufficientData()) {
            throw new InsufficientDataException(key, b.getSampleCount(), props.getMinSamples());
        }
        return b;
    }

    /** Immutable, time-ordered view of the series as it was at {@code asOf}. */
    public List<MetricPoint> snapshot(SeriesKey key, Instant asOf) {
        Instant floor = asOf.minus(props.retention());
        return repository.load(key).stream()
                .filter(p -> !p.getTimestamp().isAfter(asOf))
                .filter(p -> !p.getTimestamp().isBefore(floor))
                .toList();
    }

    public List<SeriesKey> trackedKeys(String region) {
        return List.copyOf(repository.keys(region));
    }

    public long appendCount(SeriesKey key) {
        return repository.appendCount(key);
    }

    public int minSamples() {
        return props.getMinSamples();
    }
}

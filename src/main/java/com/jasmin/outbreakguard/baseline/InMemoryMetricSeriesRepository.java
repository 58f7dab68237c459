package com.jasmin.outbreakguard.baseline;

import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.SeriesKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Copy-on-write series map. Every write swaps in a new immutable {@link Series},
 * so readers always see a stable snapshot.
 */
@Repository
@ConditionalOnProperty(prefix = "outbreak-guard.baseline", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryMetricSeriesRepository implements MetricSeriesRepository {

    private final Map<SeriesKey, Series> storage = new ConcurrentHashMap<>();

    @Override
    public List<MetricPoint> load(SeriesKey key) {
        Series s = storage.get(key);
        return s == null ? List.of() : s.points;
    }

    @Override
    public Optional<Instant> latestTimestamp(SeriesKey key) {
        Series s = storage.get(key);
        if (s == null || s.points.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(s.points.get(s.points.size() - 1).getTimestamp());
    }

    @Override
    public void upsert(SeriesKey key, MetricPoint point) {
        storage.compute(key, (k, old) -> {
            List<MetricPoint> next = new ArrayList<>(old == null ? List.of() : old.points);
            next.removeIf(p -> p.getTimestamp().equals(point.getTimestamp()));
            next.add(point);
            next.sort(Comparator.comparing(MetricPoint::getTimestamp));
            long appends = old == null ? 1 : old.appends + 1;
            return new Series(List.copyOf(next), appends);
        });
    }

    @Override
    public int evictBefore(SeriesKey key, Instant floor) {
        int[] removed = {0};
        storage.computeIfPresent(key, (k, old) -> {
            List<MetricPoint> kept = old.points.stream()
                    .filter(p -> !p.getTimestamp().isBefore(floor))
                    .toList();
            removed[0] = old.points.size() - kept.size();
            return removed[0] == 0 ? old : new Series(kept, old.appends);
        });
        return removed[0];
    }

    @Override
    public Set<SeriesKey> keys(String region) {
        Set<SeriesKey> out = new TreeSet<>();
        for (SeriesKey k : storage.keySet()) {
            if (k.getRegion().equals(region)) {
                out.add(k);
            }
        }
        return out;
    }

    @Override
    public long appendCount(SeriesKey key) {
        Series s = storage.get(key);
        return s == null ? 0L : s.appends;
    }

    private static final class Series {
        private final List<MetricPoint> points;
        private final long appends;

        private Series(List<MetricPoint> points, long appends) {
            this.points = points;
            this.appends = appends;
        }
    }
}

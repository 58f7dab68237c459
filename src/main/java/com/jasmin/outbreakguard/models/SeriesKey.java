package com.jasmin.outbreakguard.models;

import lombok.Value;

import java.util.Comparator;

/** Composite (region, data source, metric) identity of one metric series. */
@Value
public class SeriesKey implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::getRegion)
            .thenComparing(SeriesKey::getSource)
            .thenComparing(SeriesKey::getMetric);

    String region;
    DataSource source;
    String metric;

    public static SeriesKey of(String region, DataSource source, String metric) {
        return new SeriesKey(region, source, metric);
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return region + ":" + (source == null ? "unknown" : source.code()) + ":" + metric;
    }
}

package com.jasmin.outbreakguard.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary statistics of one series' history. Derived on demand, never stored.
 * A baseline with {@code insufficientData} set carries only the sample count and
 * must not be used for a verdict.
 */
@Value
@Builder
public class Baseline {
    double mean;
    double stdDev;
    double median;
    double mad;
    double q1;
    double q3;
    int sampleCount;
    Instant windowStart;
    Instant windowEnd;
    boolean insufficientData;

    public static Baseline insufficient(int sampleCount, Instant windowStart, Instant windowEnd) {
        return Baseline.builder()
                .sampleCount(sampleCount)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .insufficientData(true)
                .build();
    }

    public boolean isUsable() {
        return !insufficientData;
    }

    public double getIqr() {
        return q3 - q1;
    }
}

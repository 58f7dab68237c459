package com.jasmin.outbreakguard.detectors;

import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only input handed to every detector for one series key. The history and
 * baseline are snapshots taken before fan-out and never include the current reading.
 */
@Value
@Builder
public class DetectionContext {
    SeriesKey key;
    ReadingVector reading;
    Baseline baseline;

    /** Retained points strictly before the current reading, oldest first. */
    List<MetricPoint> history;

    /** Store write counter for the key when the snapshot was taken. */
    long seriesVersion;

    public double value() {
        return reading.getValue();
    }
}

package com.jasmin.outbreakguard.models;

import lombok.Value;

/** How the evaluation of one series key ended within a detection pass. */
@Value
public class KeyOutcome {

    public enum Status {
        /** All applicable detectors ran. */
        EVALUATED,
        /** Baseline below the minimum sample count; no verdict was made. */
        INSUFFICIENT_DATA,
        /** No reading for the key inside the window. */
        NO_DATA,
        /** At least one detector could not run; the verdict used the others. */
        DEGRADED,
        /** Supplied reading was malformed and rejected. */
        INVALID_READING,
        /** Unexpected failure, isolated to this key. */
        FAILED
    }

    SeriesKey key;
    Status status;
    String details;

    public static KeyOutcome of(SeriesKey key, Status status, String details) {
        return new KeyOutcome(key, status, details);
    }
}

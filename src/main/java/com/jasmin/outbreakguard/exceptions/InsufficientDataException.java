package com.jasmin.outbreakguard.exceptions;

import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.Getter;

/** Baseline sample count is below the configured minimum. */
@Getter
public class InsufficientDataException extends SurveillanceException {
    private final SeriesKey key;
    private final int sampleCount;
    private final int required;

    public InsufficientDataException(SeriesKey key, int sampleCount, int required) {
        super(String.format("insufficient data for %s: %d samples, %d required", key, sampleCount, required));
        this.key = key;
        this.sampleCount = sampleCount;
        this.required = required;
    }
}

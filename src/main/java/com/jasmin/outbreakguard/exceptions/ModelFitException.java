package com.jasmin.outbreakguard.exceptions;

import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.Getter;

/** The outlier model could not be fitted for a series, e.g. all-identical history. */
@Getter
public class ModelFitException extends SurveillanceException {
    private final SeriesKey key;

    public ModelFitException(SeriesKey key, String message) {
        super("model fit failed for " + key + ": " + message);
        this.key = key;
    }
}

package com.jasmin.outbreakguard.models;

/** Tag of the detector that produced a {@link DetectorVerdict}. */
public enum DetectorFamily {
    STATISTICAL,
    TEMPORAL,
    ML,
    ENVIRONMENTAL
}

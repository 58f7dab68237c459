package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    SPIKE,
    DROP,
    TREND,
    ENVIRONMENTAL,
    // Part of the persisted field set; correlation is expressed through the group id instead.
    CORRELATED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

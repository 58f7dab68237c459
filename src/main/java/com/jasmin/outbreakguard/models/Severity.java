package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Ordered from least to most severe. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** One level up, capped at {@link #CRITICAL}. */
    public Severity elevate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

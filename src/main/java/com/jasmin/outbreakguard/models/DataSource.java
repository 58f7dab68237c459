package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Channel a surveillance signal comes from. */
public enum DataSource {
    HOSPITAL("hospital"),
    SOCIAL_MEDIA("social_media"),
    ENVIRONMENTAL("environmental"),
    PHARMACY("pharmacy");

    private final String code;

    DataSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a source from its wire code or enum name, case-insensitive.
     * Returns {@code null} for blank or unknown values so validation can report them.
     */
    @JsonCreator
    public static DataSource fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (DataSource s : values()) {
            if (s.code.equals(v) || s.name().toLowerCase(Locale.ROOT).equals(v)) {
                return s;
            }
        }
        return null;
    }
}

package com.regwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Urgency tier of a monitored source. {@link #MEDIUM} is the lowest tier and the
 * default for sources that declare none.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM;

    public static Priority lowest() {
        return MEDIUM;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return lowest();
        }
        return Priority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

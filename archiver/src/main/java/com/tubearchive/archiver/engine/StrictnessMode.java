package com.tubearchive.archiver.engine;

import java.util.Locale;

/**
 * How picky the format selector is. {@code STRICT} asks for WebM first and
 * falls back to MP4 within a height cap; {@code RELAXED} takes whatever the
 * source considers best.
 */
public enum StrictnessMode {
    STRICT("strict"),
    RELAXED("relaxed");

    private final String value;

    StrictnessMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static StrictnessMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STRICT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StrictnessMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown format strictness: " + value);
    }
}

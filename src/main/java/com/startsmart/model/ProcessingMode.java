package com.startsmart.model;

import java.util.Locale;

public enum ProcessingMode {
    FAST,
    FULL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProcessingMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return FAST;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("mode must be fast or full: " + raw, e);
        }
    }
}

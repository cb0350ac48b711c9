package com.startsmart.model;

import java.util.Locale;

public enum SignalType {
    DEMAND("demand"),
    COMPLAINT("complaint"),
    MENTION("mention");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null for anything this engine does not score
     */
    public static SignalType fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (SignalType type : values()) {
            if (type.wireName.equals(key)) {
                return type;
            }
        }
        return null;
    }
}

package com.startsmart.core.diagnostics;

import java.util.Locale;

public enum DegradationCause {
    NONE,
    BUSINESS_SOURCE_UNAVAILABLE,
    SOCIAL_SOURCE_UNAVAILABLE,
    NO_DEMAND_SIGNALS,
    CONTEXTUAL_TIMEOUT,
    CONTEXTUAL_ERROR,
    CONTEXTUAL_MISSING_CATEGORY,
    EXPLAIN_FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Causes that mean the score rests on incomplete data.
     */
    public boolean lowersConfidence() {
        return this == BUSINESS_SOURCE_UNAVAILABLE || this == SOCIAL_SOURCE_UNAVAILABLE || this == NO_DEMAND_SIGNALS;
    }

    public boolean forcesRuleOnly() {
        return this == CONTEXTUAL_TIMEOUT || this == CONTEXTUAL_ERROR || this == CONTEXTUAL_MISSING_CATEGORY;
    }
}

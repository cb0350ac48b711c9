package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SocialSignal {
    public final String id;
    public final String category;
    public final String text;
    public final Instant timestamp;
    public final Double lat;
    public final Double lon;
    public final SignalType type;
    public final double engagement;
    public final String gridId;

    public boolean hasLocation() {
        return lat != null && lon != null;
    }
}

package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class BusinessRecord {
    public final String id;
    public final String name;
    public final String category;
    public final double lat;
    public final double lon;
    /** 0-5, null when the directory has no rating. */
    public final Double rating;
    public final int reviewCount;
    /** 0-4, null when unknown. */
    public final Integer priceLevel;
    @Builder.Default
    public final List<String> types = List.of();
    public final String gridId;
}

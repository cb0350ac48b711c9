package com.startsmart.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Explanation {
    public static final Explanation EMPTY = new Explanation(List.of(), List.of(), "");

    @Builder.Default
    public final List<PostEvidence> topPosts = List.of();
    @Builder.Default
    public final List<CompetitorEvidence> competitors = List.of();
    public final String rationale;
}

package com.startsmart.metrics;

import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GridMetrics;
import com.startsmart.model.SignalType;
import com.startsmart.model.SocialSignal;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsAggregatorTest {
    private static final Instant NOW = Instant.parse("2026-10-15T00:00:00Z");
    private final MetricsAggregator aggregator = new MetricsAggregator();

    private static BusinessRecord business(String id, String category, String gridId, Double rating, int reviews) {
        return BusinessRecord.builder()
                .id(id).name(id).category(category).lat(24.82).lon(67.03)
                .rating(rating).reviewCount(reviews).gridId(gridId)
                .build();
    }

    private static SocialSignal signal(String id, String category, String gridId, SignalType type, Instant at) {
        return SocialSignal.builder()
                .id(id).category(category).text("t").timestamp(at).type(type).gridId(gridId)
                .build();
    }

    @Test
    void aggregate_shouldCountPerGridInKnownOrder() {
        List<BusinessRecord> businesses = List.of(
                business("b1", "gym", "g2", 4.0, 10),
                business("b2", "GYM", "g2", null, 5),
                business("b3", "cafe", "g2", 4.9, 100),
                business("b4", "gym", "elsewhere", 3.0, 1)
        );
        List<SocialSignal> signals = List.of(
                signal("s1", "gym", "g1", SignalType.MENTION, NOW.minusSeconds(3600)),
                signal("s2", "gym", "g1", SignalType.DEMAND, NOW.minusSeconds(7200)),
                signal("s3", "gym", "g1", SignalType.COMPLAINT, NOW.minusSeconds(7200)),
                signal("s4", "cafe", "g1", SignalType.MENTION, NOW)
        );

        List<GridMetrics> out = aggregator.aggregate("gym", List.of("g1", "g2", "g3"), businesses, signals, 90, NOW);

        assertEquals(List.of("g1", "g2", "g3"), out.stream().map(m -> m.gridId).toList());
        GridMetrics g1 = out.get(0);
        assertEquals(0, g1.businessCount);
        assertEquals(1, g1.instagramVolume);
        assertEquals(2, g1.redditMentions);
        assertNull(g1.avgRating);
        GridMetrics g2 = out.get(1);
        assertEquals(2, g2.businessCount);
        assertEquals(4.0, g2.avgRating, 1e-12);
        assertEquals(15, g2.totalReviews);
        assertEquals(0, out.get(2).totalDemandSignals());
    }

    @Test
    void aggregate_shouldSkipSignalsOutsideWindow() {
        List<SocialSignal> signals = List.of(
                signal("fresh", "gym", "g1", SignalType.DEMAND, NOW.minusSeconds(86_400L * 89)),
                signal("stale", "gym", "g1", SignalType.DEMAND, NOW.minusSeconds(86_400L * 91)),
                signal("undated", "gym", "g1", SignalType.DEMAND, null)
        );

        List<GridMetrics> windowed = aggregator.aggregate("gym", List.of("g1"), List.of(), signals, 90, NOW);
        List<GridMetrics> unbounded = aggregator.aggregate("gym", List.of("g1"), List.of(), signals, 0, NOW);

        assertEquals(1, windowed.get(0).redditMentions);
        assertEquals(3, unbounded.get(0).redditMentions);
    }

    @Test
    void inWindow_shouldTreatUndatedSignalsAsOutsideActiveWindow() {
        SocialSignal undated = signal("u", "gym", "g1", SignalType.MENTION, null);

        assertFalse(MetricsAggregator.inWindow(undated, 30, NOW));
        assertTrue(MetricsAggregator.inWindow(undated, 0, NOW));
    }
}

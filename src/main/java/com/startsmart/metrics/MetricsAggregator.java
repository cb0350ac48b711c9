package com.startsmart.metrics;

import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GridMetrics;
import com.startsmart.model.SignalType;
import com.startsmart.model.SocialSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts competitors and demand signals per grid for one category.
 * Mentions feed the instagram channel; demand and complaint posts feed the reddit channel.
 */
public final class MetricsAggregator {
    private static final Logger LOG = LogManager.getLogger(MetricsAggregator.class);

    /**
     * @param knownGridIds grids to report, in output order; records tagged with other grids are ignored
     * @param windowDays   signals older than this many days before {@code now} are skipped; 0 disables the window
     */
    public List<GridMetrics> aggregate(
            String category,
            Collection<String> knownGridIds,
            Collection<BusinessRecord> businesses,
            Collection<SocialSignal> signals,
            int windowDays,
            Instant now
    ) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (String gridId : knownGridIds) {
            tallies.put(gridId, new Tally());
        }

        int ignored = 0;
        if (businesses != null) {
            for (BusinessRecord b : businesses) {
                if (b == null || !sameCategory(category, b.category)) {
                    continue;
                }
                Tally tally = b.gridId == null ? null : tallies.get(b.gridId);
                if (tally == null) {
                    ignored++;
                    continue;
                }
                tally.businessCount++;
                tally.totalReviews += Math.max(0, b.reviewCount);
                if (b.rating != null) {
                    tally.ratingSum += b.rating;
                    tally.ratedCount++;
                }
            }
        }

        if (signals != null) {
            for (SocialSignal s : signals) {
                if (s == null || s.type == null || !sameCategory(category, s.category)) {
                    continue;
                }
                if (!inWindow(s, windowDays, now)) {
                    continue;
                }
                Tally tally = s.gridId == null ? null : tallies.get(s.gridId);
                if (tally == null) {
                    ignored++;
                    continue;
                }
                if (s.type == SignalType.MENTION) {
                    tally.instagramVolume++;
                } else {
                    tally.redditMentions++;
                }
            }
        }
        if (ignored > 0) {
            LOG.debug("category={} ignored {} records outside the known grids", category, ignored);
        }

        List<GridMetrics> out = new ArrayList<>(tallies.size());
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally t = entry.getValue();
            out.add(GridMetrics.builder()
                    .gridId(entry.getKey())
                    .category(category)
                    .businessCount(t.businessCount)
                    .instagramVolume(t.instagramVolume)
                    .redditMentions(t.redditMentions)
                    .avgRating(t.ratedCount == 0 ? null : t.ratingSum / t.ratedCount)
                    .totalReviews(t.totalReviews)
                    .build());
        }
        return out;
    }

    /**
     * True when the signal falls inside the window. Undated signals are outside any active window.
     */
    public static boolean inWindow(SocialSignal signal, int windowDays, Instant now) {
        if (windowDays <= 0 || now == null) {
            return true;
        }
        Instant cutoff = now.minus(Duration.ofDays(windowDays));
        return signal.timestamp != null && !signal.timestamp.isBefore(cutoff);
    }

    private static boolean sameCategory(String wanted, String actual) {
        return wanted != null && wanted.equalsIgnoreCase(actual == null ? "" : actual.trim());
    }

    private static final class Tally {
        private int businessCount;
        private int instagramVolume;
        private int redditMentions;
        private int totalReviews;
        private double ratingSum;
        private int ratedCount;
    }
}

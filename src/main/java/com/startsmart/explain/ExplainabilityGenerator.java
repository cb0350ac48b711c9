package com.startsmart.explain;

import com.startsmart.config.Config;
import com.startsmart.grid.GeoMath;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.CompetitorEvidence;
import com.startsmart.model.Explanation;
import com.startsmart.model.GeoPoint;
import com.startsmart.model.PostEvidence;
import com.startsmart.model.SocialSignal;
import com.startsmart.utils.Numbers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Picks supporting evidence for a score and phrases a one-sentence rationale.
 */
public final class ExplainabilityGenerator {
    public static final double HIGH_OPPORTUNITY = 0.7;
    public static final double MODERATE_OPPORTUNITY = 0.4;

    private static final String ELLIPSIS = "...";

    private static final Comparator<SocialSignal> BY_ENGAGEMENT = Comparator
            .comparingDouble((SocialSignal s) -> s.engagement).reversed()
            .thenComparing(s -> s.id == null ? "" : s.id);

    private static final Comparator<BusinessRecord> BY_RATING_NULLS_LAST = Comparator
            .comparing((BusinessRecord b) -> b.rating, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(b -> b.id == null ? "" : b.id);

    private final int topPosts;
    private final int topCompetitors;
    private final int textMaxChars;

    public ExplainabilityGenerator(Config config) {
        this(config.getInt("explain.top_posts", 3), config.getInt("explain.top_competitors", 5), config.getInt("explain.text_max_chars", 200));
    }

    public ExplainabilityGenerator(int topPosts, int topCompetitors, int textMaxChars) {
        this.topPosts = Math.max(0, topPosts);
        this.topCompetitors = Math.max(0, topCompetitors);
        this.textMaxChars = Math.max(1, textMaxChars);
    }

    /**
     * @param signals     candidate posts, already restricted to the grid/point and category
     * @param competitors candidate competitors, already restricted to the grid/point and category
     */
    public Explanation explain(
            double score,
            GeoPoint center,
            Collection<SocialSignal> signals,
            Collection<BusinessRecord> competitors,
            int businessCount,
            int demandSignals
    ) {
        return Explanation.builder()
                .topPosts(topPosts(signals))
                .competitors(topCompetitors(competitors, center))
                .rationale(rationale(score, businessCount, demandSignals))
                .build();
    }

    public List<PostEvidence> topPosts(Collection<SocialSignal> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        return signals.stream()
                .filter(s -> s != null && s.type != null)
                .sorted(BY_ENGAGEMENT)
                .limit(topPosts)
                .map(s -> new PostEvidence(s.id, truncate(s.text), s.type, s.engagement, s.timestamp))
                .toList();
    }

    public List<CompetitorEvidence> topCompetitors(Collection<BusinessRecord> businesses, GeoPoint center) {
        if (businesses == null || businesses.isEmpty()) {
            return List.of();
        }
        List<CompetitorEvidence> out = new ArrayList<>();
        businesses.stream()
                .filter(b -> b != null)
                .sorted(BY_RATING_NULLS_LAST)
                .limit(topCompetitors)
                .forEach(b -> out.add(new CompetitorEvidence(
                        b.id,
                        b.name,
                        b.rating,
                        b.reviewCount,
                        b.lat,
                        b.lon,
                        Numbers.round(GeoMath.haversineKm(center.lat(), center.lon(), b.lat, b.lon), 2)
                )));
        return List.copyOf(out);
    }

    public String rationale(double score, int businessCount, int demandSignals) {
        if (score >= HIGH_OPPORTUNITY) {
            return String.format(Locale.ROOT, "High demand (%d posts), low competition (%d businesses)", demandSignals, businessCount);
        }
        if (score >= MODERATE_OPPORTUNITY) {
            return String.format(Locale.ROOT, "Moderate opportunity with %d competitors and %d demand signals", businessCount, demandSignals);
        }
        return String.format(Locale.ROOT, "Saturated market with %d businesses and limited demand", businessCount);
    }

    String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= textMaxChars) {
            return text;
        }
        return text.substring(0, textMaxChars) + ELLIPSIS;
    }
}

package com.startsmart.data;

import com.startsmart.core.UpstreamUnavailableException;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GeoPoint;
import com.startsmart.model.SignalType;
import com.startsmart.model.SocialSignal;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonFileSourcesTest {
    private static final BoundingBox REGION = new BoundingBox(24.8260, 24.8233, 67.05745, 67.0545);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-15T00:00:00Z"), ZoneOffset.UTC);

    private static Path fixture(String name) throws Exception {
        return Path.of(JsonFileSourcesTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void businessFetch_shouldFilterByCategoryAndBounds() throws Exception {
        JsonFileBusinessSource source = new JsonFileBusinessSource(fixture("businesses.json"));

        List<BusinessRecord> gyms = source.fetch("GYM", REGION);
        List<BusinessRecord> all = source.fetch(null, REGION);

        assertEquals(List.of("b-1", "b-2"), ids(gyms));
        assertEquals(List.of("b-1", "b-2", "b-3", "b-6"), ids(all));
        BusinessRecord cafe = all.get(2);
        assertNull(cafe.rating);
        assertNull(cafe.priceLevel);
        assertEquals(List.of("cafe", "food"), cafe.types);
    }

    @Test
    void businessFetchNear_shouldUseHaversineRadius() throws Exception {
        JsonFileBusinessSource source = new JsonFileBusinessSource(fixture("businesses.json"));

        List<BusinessRecord> near = source.fetchNear("gym", new GeoPoint(24.8245, 67.0560), 130.0);

        assertEquals(List.of("b-1"), ids(near));
    }

    @Test
    void socialFetch_shouldApplyWindowBoundsAndTypeFilters() throws Exception {
        JsonFileSocialSource source = new JsonFileSocialSource(fixture("social_posts.json"), CLOCK);

        List<SocialSignal> gym = source.fetch("gym", REGION, 90);

        assertEquals(List.of("p-1", "p-2", "p-5"), gym.stream().map(s -> s.id).collect(Collectors.toList()));
        assertEquals(SignalType.COMPLAINT, gym.get(1).type);
        assertEquals("DHA-Phase2-001-001", gym.get(2).gridId);
        assertEquals(42.0, gym.get(0).engagement, 1e-9);
    }

    @Test
    void socialFetch_shouldKeepOldPostsWhenWindowDisabled() throws Exception {
        JsonFileSocialSource source = new JsonFileSocialSource(fixture("social_posts.json"), CLOCK);

        List<SocialSignal> gym = source.fetch("gym", REGION, 0);

        assertEquals(4, gym.size());
    }

    @Test
    void sources_shouldReportUnreadableFilesAsUpstreamUnavailable() throws Exception {
        JsonFileBusinessSource missing = new JsonFileBusinessSource(Path.of("does-not-exist.json"));
        JsonFileSocialSource broken = new JsonFileSocialSource(fixture("broken.json"), CLOCK);

        assertThrows(UpstreamUnavailableException.class, () -> missing.fetch("gym", REGION));
        assertThrows(UpstreamUnavailableException.class, () -> broken.fetch("gym", REGION, 90));
    }

    @Test
    void sources_shouldSkipMalformedRowsAndKeepTheRest() throws Exception {
        JsonFileBusinessSource businesses = new JsonFileBusinessSource(fixture("businesses_bad_row.json"));
        JsonFileSocialSource social = new JsonFileSocialSource(fixture("social_posts_bad_row.json"), CLOCK);

        assertEquals(List.of("b-1"), ids(businesses.fetch("gym", REGION)));
        assertEquals(List.of("p-1"), social.fetch("gym", REGION, 90).stream().map(s -> s.id).collect(Collectors.toList()));
    }

    private static List<String> ids(List<BusinessRecord> records) {
        return records.stream().map(b -> b.id).collect(Collectors.toList());
    }
}

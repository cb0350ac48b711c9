package com.startsmart.config;

import com.startsmart.core.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigTest {

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMapsAndLists() {
        Map<String, Object> raw = Map.of(
                "grid", Map.of(
                        "cell_size_m", 120,
                        "regions", List.of("north", "south")
                ),
                "scoring", Map.of("weight_rule", "0.7")
        );

        Config config = Config.fromConfigurationProperties(Path.of("."), raw);

        assertEquals(120, config.getInt("grid.cell_size_m"));
        assertEquals(List.of("north", "south"), config.getList("grid.regions"));
        assertEquals(0.7, config.getDouble("scoring.weight_rule"), 1e-12);
        assertEquals(0.35, config.getDouble("scoring.weight_contextual"), 1e-12);
        assertEquals("override", config.sourceOf("grid.cell_size_m"));
        assertEquals("default", config.sourceOf("scoring.weight_contextual"));
    }

    @Test
    void getList_shouldSplitOnCommaAndSemicolon() {
        Config config = Config.ofDefaults(Map.of("scoring.categories", " gym; cafe ,, bakery "));

        assertEquals(List.of("gym", "cafe", "bakery"), config.getList("scoring.categories"));
    }

    @Test
    void typedGetters_shouldFallBackOnUnparseableValues() {
        Config config = Config.ofDefaults(Map.of(
                "pipeline.threads", "many",
                "contextual.timeout_ms", "abc"
        ));

        assertEquals(7, config.getInt("pipeline.threads", 7));
        assertEquals(250L, config.getLong("contextual.timeout_ms", 250L));
        assertEquals("fallback", config.getString("no.such.key", "fallback"));
    }

    @Test
    void requireDouble_shouldRejectMissingAndMalformedValues() {
        Config config = Config.ofDefaults(Map.of("grid.region.x.north", "north-ish"));

        assertThrows(ConfigurationException.class, () -> config.requireDouble("grid.region.x.north"));
        assertThrows(ConfigurationException.class, () -> config.requireDouble("grid.region.x.south"));
    }

    @Test
    void load_shouldLetWorkingDirFileOverrideClasspath(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "explain.top_posts=7\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir);

        assertEquals(7, config.getInt("explain.top_posts"));
        assertEquals("override", config.sourceOf("explain.top_posts"));
        assertEquals("resource", config.sourceOf("grid.regions"));
        assertEquals(dir.resolve("data/businesses.json").normalize(), config.getPath("source.business.path"));
    }
}

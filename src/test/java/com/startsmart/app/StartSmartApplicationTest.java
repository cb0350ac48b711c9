package com.startsmart.app;

import com.startsmart.config.Config;
import com.startsmart.core.ConfigurationException;
import com.startsmart.pipeline.RecommendationPipeline;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StartSmartApplicationTest {
    private ByteArrayOutputStream buffer;
    private StartSmartApplication app;
    private RecommendationPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        app = new StartSmartApplication(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);
        pipeline = EngineWiring.pipeline(fixtureConfig(Map.of()));
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void run_help_shouldExitZero() {
        assertEquals(StartSmartApplication.EXIT_OK, app.run(new String[]{"--help"}));
    }

    @Test
    void run_badArguments_shouldExitWithUsage() {
        assertEquals(StartSmartApplication.EXIT_USAGE, app.run(new String[]{"--bogus"}));
        assertEquals(StartSmartApplication.EXIT_USAGE, app.run(new String[]{}));
        assertEquals(StartSmartApplication.EXIT_USAGE, app.run(new String[]{"--rank", "--evaluate"}));
    }

    @Test
    void rank_shouldPrintJsonArray() throws Exception {
        int exit = app.run(parse("--rank", "--region", "DHA-Phase2", "--category", "gym", "--limit", "2"), pipeline);

        assertEquals(StartSmartApplication.EXIT_OK, exit);
        JSONArray results = new JSONArray(output());
        assertEquals(2, results.length());
        JSONObject first = results.getJSONObject(0);
        assertEquals("gym", first.getString("best_category"));
        assertEquals("fast", first.getString("processing_mode"));
        assertTrue(first.getString("grid_id").startsWith("DHA-Phase2-"));
        assertTrue(first.getJSONObject("category_scores").has("gym"));
    }

    @Test
    void evaluate_shouldPrintScoresForEveryCategory() throws Exception {
        int exit = app.run(parse("--evaluate", "--lat", "24.8245", "--lon", "67.0560", "--radius", "300", "--mode", "full"), pipeline);

        assertEquals(StartSmartApplication.EXIT_OK, exit);
        JSONObject result = new JSONObject(output());
        assertEquals("full", result.getString("processing_mode"));
        assertTrue(result.getJSONObject("category_scores").has("gym"));
        assertTrue(result.getJSONObject("category_scores").has("cafe"));
    }

    @Test
    void explain_shouldPrintEvidence() throws Exception {
        int exit = app.run(parse("--explain", "--grid", "DHA-Phase2-000-000", "--category", "gym"), pipeline);

        assertEquals(StartSmartApplication.EXIT_OK, exit);
        JSONObject result = new JSONObject(output());
        assertTrue(result.has("top_posts"));
        assertTrue(result.has("competitors"));
        assertTrue(result.has("rationale"));
    }

    @Test
    void run_shouldRejectMissingOrMalformedValues() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> app.run(parse("--rank", "--category", "gym"), pipeline));
        assertThrows(IllegalArgumentException.class,
                () -> app.run(parse("--rank", "--region", "DHA-Phase2", "--category", "gym", "--limit", "ten"), pipeline));
        assertThrows(IllegalArgumentException.class,
                () -> app.run(parse("--evaluate", "--lat", "north", "--lon", "67.0"), pipeline));
    }

    @Test
    void evaluator_unknownProvider_shouldFailConfiguration() throws Exception {
        Config config = fixtureConfig(Map.of("contextual.provider", "oracle"));

        assertThrows(ConfigurationException.class, () -> EngineWiring.evaluator(config));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(StartSmartApplication.buildOptions(), args);
    }

    private static Config fixtureConfig(Map<String, String> extra) throws Exception {
        Map<String, String> overrides = new HashMap<>();
        overrides.put("grid.regions", "DHA-Phase2");
        overrides.put("grid.region.DHA-Phase2.north", "24.8260");
        overrides.put("grid.region.DHA-Phase2.south", "24.8233");
        overrides.put("grid.region.DHA-Phase2.east", "67.05745");
        overrides.put("grid.region.DHA-Phase2.west", "67.0545");
        overrides.put("source.business.path", fixture("businesses.json").toString());
        overrides.put("source.social.path", fixture("social_posts.json").toString());
        overrides.put("source.retry.max", "0");
        overrides.put("pipeline.threads", "2");
        overrides.putAll(extra);
        return Config.ofDefaults(overrides);
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(StartSmartApplicationTest.class.getResource("/fixtures/" + name).toURI());
    }
}

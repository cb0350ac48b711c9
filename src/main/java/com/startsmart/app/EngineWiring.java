package com.startsmart.app;

import com.startsmart.config.Config;
import com.startsmart.contextual.ContextualEvaluator;
import com.startsmart.contextual.LangChainContextualEvaluator;
import com.startsmart.contextual.StaticContextualEvaluator;
import com.startsmart.core.ConfigurationException;
import com.startsmart.data.BusinessSource;
import com.startsmart.data.ConfigGridStore;
import com.startsmart.data.JsonFileBusinessSource;
import com.startsmart.data.JsonFileSocialSource;
import com.startsmart.data.RetryPolicy;
import com.startsmart.data.RetryingBusinessSource;
import com.startsmart.data.RetryingSocialSource;
import com.startsmart.data.SocialSource;
import com.startsmart.grid.GridIndex;
import com.startsmart.pipeline.RecommendationPipeline;
import com.startsmart.rules.RuleBook;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds engine components from a {@link Config}. Shared by the CLI and the Spring bootstrap.
 */
public final class EngineWiring {
    private static final Logger LOG = LogManager.getLogger(EngineWiring.class);

    private EngineWiring() {
    }

    public static GridIndex gridIndex(Config config) {
        ConfigGridStore store = new ConfigGridStore(config);
        return GridIndex.load(store, store.regions());
    }

    public static RuleBook ruleBook(Config config) {
        List<String> tables = new ArrayList<>();
        tables.add(RuleBook.GRID_TABLE);
        tables.addAll(config.getList("scoring.categories"));
        return RuleBook.loadClasspath(config.getString("rules.dir", "rules"), tables);
    }

    public static BusinessSource businessSource(Config config) {
        return new RetryingBusinessSource(
                new JsonFileBusinessSource(config.getPath("source.business.path")),
                RetryPolicy.fromConfig(config)
        );
    }

    public static SocialSource socialSource(Config config) {
        return new RetryingSocialSource(
                new JsonFileSocialSource(config.getPath("source.social.path")),
                RetryPolicy.fromConfig(config)
        );
    }

    public static ContextualEvaluator evaluator(Config config) {
        List<String> categories = config.getList("scoring.categories");
        String provider = config.getString("contextual.provider", "stub").trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "stub":
            case "static":
                return StaticContextualEvaluator.neutral(categories);
            case "ollama":
                return new LangChainContextualEvaluator(config, categories);
            default:
                throw new ConfigurationException("unknown contextual.provider: " + provider);
        }
    }

    public static RecommendationPipeline pipeline(Config config) {
        GridIndex index = gridIndex(config);
        RuleBook rules = ruleBook(config);
        ContextualEvaluator evaluator = evaluator(config);
        LOG.info("engine wired: regions={}, grids={}, rule tables={}, evaluator={}",
                index.regions(), index.size(), rules.names(), evaluator.name());
        return new RecommendationPipeline(config, index, rules, businessSource(config), socialSource(config), evaluator);
    }
}

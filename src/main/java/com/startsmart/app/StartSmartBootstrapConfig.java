package com.startsmart.app;

import com.startsmart.app.properties.ContextualProperties;
import com.startsmart.app.properties.GridProperties;
import com.startsmart.app.properties.ScoringProperties;
import com.startsmart.config.Config;
import com.startsmart.contextual.ContextualEvaluator;
import com.startsmart.core.ConfigurationException;
import com.startsmart.data.BusinessSource;
import com.startsmart.data.SocialSource;
import com.startsmart.grid.GridIndex;
import com.startsmart.grid.GridPartitioner;
import com.startsmart.pipeline.RecommendationPipeline;
import com.startsmart.rules.RuleBook;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;

/**
 * Exposes the engine as beans so an API layer can embed it.
 */
@Configuration
@EnableConfigurationProperties({GridProperties.class, ScoringProperties.class, ContextualProperties.class})
public class StartSmartBootstrapConfig {
    private static final Logger LOG = LogManager.getLogger(StartSmartBootstrapConfig.class);

    @Bean
    public Config startSmartConfig(
            Environment environment,
            GridProperties gridProperties,
            ScoringProperties scoringProperties,
            ContextualProperties contextualProperties
    ) {
        validate(gridProperties, scoringProperties);
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.fromConfigurationProperties(workingDir, rawProperties);
        LOG.info("bootstrap config: regions={}, categories={}, contextual.provider={} (source={})",
                gridProperties.getRegions(), scoringProperties.getCategories(),
                contextualProperties.getProvider(), config.sourceOf("contextual.provider"));
        return config;
    }

    @Bean
    @Lazy
    public GridIndex gridIndex(Config config) {
        return EngineWiring.gridIndex(config);
    }

    @Bean
    @Lazy
    public RuleBook ruleBook(Config config) {
        return EngineWiring.ruleBook(config);
    }

    @Bean
    @Lazy
    public BusinessSource businessSource(Config config) {
        return EngineWiring.businessSource(config);
    }

    @Bean
    @Lazy
    public SocialSource socialSource(Config config) {
        return EngineWiring.socialSource(config);
    }

    @Bean
    @Lazy
    public ContextualEvaluator contextualEvaluator(Config config) {
        return EngineWiring.evaluator(config);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public RecommendationPipeline recommendationPipeline(
            Config config,
            GridIndex gridIndex,
            RuleBook ruleBook,
            BusinessSource businessSource,
            SocialSource socialSource,
            ContextualEvaluator contextualEvaluator
    ) {
        return new RecommendationPipeline(config, gridIndex, ruleBook, businessSource, socialSource, contextualEvaluator);
    }

    static void validate(GridProperties grid, ScoringProperties scoring) {
        if (grid.getCellSizeM() < GridPartitioner.MIN_CELL_SIZE_M || grid.getCellSizeM() > GridPartitioner.MAX_CELL_SIZE_M) {
            throw new ConfigurationException("grid.cell_size_m out of range: " + grid.getCellSizeM());
        }
        double sum = scoring.getWeightRule() + scoring.getWeightContextual();
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new ConfigurationException("scoring weights must sum to 1, got " + sum);
        }
        if (scoring.getCategories() == null || scoring.getCategories().isEmpty()) {
            throw new ConfigurationException("scoring.categories must list at least one category");
        }
    }
}

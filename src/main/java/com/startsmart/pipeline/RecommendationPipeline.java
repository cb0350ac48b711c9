package com.startsmart.pipeline;

import com.startsmart.bev.BevGenerator;
import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.config.Config;
import com.startsmart.contextual.ContextualEvaluator;
import com.startsmart.core.ConfigurationException;
import com.startsmart.core.NotFoundException;
import com.startsmart.core.PipelineState;
import com.startsmart.core.RequestContext;
import com.startsmart.core.RunTelemetry;
import com.startsmart.core.UpstreamUnavailableException;
import com.startsmart.core.diagnostics.DegradationCause;
import com.startsmart.core.diagnostics.Outcome;
import com.startsmart.data.BusinessSource;
import com.startsmart.data.SocialSource;
import com.startsmart.explain.ExplainabilityGenerator;
import com.startsmart.grid.GeoMath;
import com.startsmart.grid.GridIndex;
import com.startsmart.metrics.ConfidenceCalculator;
import com.startsmart.metrics.MetricsAggregator;
import com.startsmart.metrics.Normalizer;
import com.startsmart.model.BoundingBox;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.CategoryScore;
import com.startsmart.model.ContextualAssessment;
import com.startsmart.model.Explanation;
import com.startsmart.model.GeoPoint;
import com.startsmart.model.GridCell;
import com.startsmart.model.GridMetrics;
import com.startsmart.model.ProcessingMode;
import com.startsmart.model.Recommendation;
import com.startsmart.model.SignalType;
import com.startsmart.model.SocialSignal;
import com.startsmart.rules.RuleBook;
import com.startsmart.rules.RuleEngine;
import com.startsmart.scoring.ScoreCombiner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point for callers: grid sweeps ({@link #rank}), point queries ({@link #evaluate}) and
 * per-grid evidence ({@link #explain}).
 *
 * <p>Grid index and rule tables are swapped only through {@link #reload}, which waits for in-flight requests.
 * A failure inside one grid never fails a sweep: contextual problems fall back to the rule score and
 * source outages score with the data that is left, both flagged on the result.</p>
 */
public final class RecommendationPipeline implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(RecommendationPipeline.class);
    private static final long CANCEL_POLL_MS = 100L;

    private final List<String> categories;
    private final int windowDays;
    private final double defaultRadiusM;
    private final BusinessSource businessSource;
    private final SocialSource socialSource;
    private final BevGenerator bevGenerator;
    private final MetricsAggregator aggregator = new MetricsAggregator();
    private final Normalizer normalizer = new Normalizer();
    private final RuleEngine ruleEngine = new RuleEngine();
    private final ScoreCombiner combiner;
    private final ExplainabilityGenerator explainer;
    private final ContextualGuard contextualGuard;
    private final ExecutorService sweepExecutor;
    private final Clock clock;

    private final ReentrantReadWriteLock reloadLock = new ReentrantReadWriteLock();
    private GridIndex gridIndex;
    private RuleBook ruleBook;

    public RecommendationPipeline(
            Config config,
            GridIndex gridIndex,
            RuleBook ruleBook,
            BusinessSource businessSource,
            SocialSource socialSource,
            ContextualEvaluator evaluator
    ) {
        this(config, gridIndex, ruleBook, businessSource, socialSource, evaluator, Clock.systemUTC());
    }

    public RecommendationPipeline(
            Config config,
            GridIndex gridIndex,
            RuleBook ruleBook,
            BusinessSource businessSource,
            SocialSource socialSource,
            ContextualEvaluator evaluator,
            Clock clock
    ) {
        this.categories = config.getList("scoring.categories");
        if (categories.isEmpty()) {
            throw new ConfigurationException("scoring.categories must list at least one category");
        }
        validateRuleBook(ruleBook, categories);
        this.gridIndex = gridIndex;
        this.ruleBook = ruleBook;
        this.windowDays = config.getInt("aggregation.window_days", 90);
        this.defaultRadiusM = config.getDouble("bev.radius_m", 500.0);
        this.businessSource = businessSource;
        this.socialSource = socialSource;
        this.bevGenerator = new BevGenerator(businessSource, config);
        this.combiner = new ScoreCombiner(config);
        this.explainer = new ExplainabilityGenerator(config);
        int threads = Math.max(1, config.getInt("pipeline.threads", 4));
        long timeoutMs = Math.max(1L, config.getLong("contextual.timeout_ms", config.getInt("contextual.timeout_sec", 10) * 1000L));
        long queueTimeoutMs = Math.max(timeoutMs, config.getLong("contextual.queue_timeout_ms", 60_000L));
        this.contextualGuard = new ContextualGuard(evaluator, timeoutMs, queueTimeoutMs, threads);
        AtomicInteger seq = new AtomicInteger();
        this.sweepExecutor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "sweep-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.clock = clock;
    }

    public List<String> categories() {
        return categories;
    }

    /**
     * Replaces the grid index and rule tables once no request is running.
     */
    public void reload(GridIndex newIndex, RuleBook newRuleBook) {
        validateRuleBook(newRuleBook, categories);
        reloadLock.writeLock().lock();
        try {
            this.gridIndex = newIndex;
            this.ruleBook = newRuleBook;
            LOG.info("pipeline reloaded: {} grids, rule tables {}", newIndex.size(), newRuleBook.names());
        } finally {
            reloadLock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- grid sweep

    public List<Recommendation> rank(String region, String category, int limit) {
        return rank(region, category, limit, ProcessingMode.FAST);
    }

    public List<Recommendation> rank(String region, String category, int limit, ProcessingMode mode) {
        return rank(region, category, limit, mode, new RequestContext(mode.wireName()));
    }

    public List<Recommendation> rank(String region, String category, int limit, ProcessingMode mode, RequestContext ctx) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        reloadLock.readLock().lock();
        try {
            return sweep(gridIndex, ruleBook, region, requireCategory(category), limit, mode, ctx);
        } finally {
            reloadLock.readLock().unlock();
        }
    }

    private List<Recommendation> sweep(
            GridIndex index,
            RuleBook book,
            String region,
            String category,
            int limit,
            ProcessingMode mode,
            RequestContext ctx
    ) {
        RunTelemetry telemetry = ctx.telemetry();
        List<GridCell> cells = index.cells(region);
        BoundingBox bounds = index.bounds(region);
        Instant now = clock.instant();

        ctx.moveTo(PipelineState.AGGREGATING);
        telemetry.startStep(RunTelemetry.STEP_AGGREGATE);
        Set<DegradationCause> requestCauses = EnumSet.noneOf(DegradationCause.class);
        RegionData data = loadRegion(index, region, category, bounds, requestCauses);
        List<String> gridIds = cells.stream().map(c -> c.id).toList();
        List<GridMetrics> raw = aggregator.aggregate(category, gridIds, data.businesses, data.signals, windowDays, now);
        telemetry.endStep(RunTelemetry.STEP_AGGREGATE, data.businesses.size() + data.signals.size(), raw.size(), requestCauses.size());

        ctx.moveTo(PipelineState.NORMALIZING);
        telemetry.startStep(RunTelemetry.STEP_NORMALIZE);
        List<GridMetrics> normalized = normalizer.normalizeAll(raw);
        telemetry.endStep(RunTelemetry.STEP_NORMALIZE, raw.size(), normalized.size(), 0);

        ctx.moveTo(PipelineState.RULE_SCORING);
        telemetry.startStep(RunTelemetry.STEP_RULE);
        Map<String, GridCell> cellsById = new HashMap<>();
        for (GridCell cell : cells) {
            cellsById.put(cell.id, cell);
        }
        List<GridWork> work = new ArrayList<>(normalized.size());
        int ruleErrors = 0;
        for (GridMetrics metrics : normalized) {
            try {
                CategoryScore ruleScore = ruleEngine.evaluate(book.table(RuleBook.GRID_TABLE), metrics, category);
                work.add(new GridWork(cellsById.get(metrics.gridId), metrics, ruleScore));
            } catch (RuntimeException e) {
                ruleErrors++;
                LOG.warn("grid {} dropped from sweep, rule scoring failed: {}", metrics.gridId, e.getMessage(), e);
            }
        }
        telemetry.endStep(RunTelemetry.STEP_RULE, normalized.size(), work.size(), ruleErrors);

        if (mode == ProcessingMode.FULL) {
            ctx.moveTo(PipelineState.CONTEXTUAL_PENDING);
            telemetry.startStep(RunTelemetry.STEP_LLM);
            assessGrids(work, ctx);
            long failed = work.stream().filter(w -> !w.assessment.success).count();
            telemetry.endStep(RunTelemetry.STEP_LLM, work.size(), work.size() - failed, failed);
        }

        ctx.moveTo(PipelineState.COMBINING);
        telemetry.startStep(RunTelemetry.STEP_COMBINE);
        for (GridWork w : work) {
            w.causes.addAll(requestCauses);
            w.finalScore = combineOne(w.ruleScore, w.assessment, mode, w.causes);
            w.confidence = ConfidenceCalculator.confidence(w.metrics);
            if (w.metrics.totalDemandSignals() == 0) {
                w.causes.add(DegradationCause.NO_DEMAND_SIGNALS);
            }
        }
        work.sort(RankingOrder.<GridWork>of(w -> w.finalScore.score, w -> w.confidence, w -> w.metrics.gridId));
        List<GridWork> top = new ArrayList<>(work.subList(0, Math.min(limit, work.size())));
        telemetry.endStep(RunTelemetry.STEP_COMBINE, work.size(), top.size(), 0);

        ctx.moveTo(PipelineState.EXPLAINING);
        telemetry.startStep(RunTelemetry.STEP_EXPLAIN);
        Map<String, List<SocialSignal>> postsByGrid = new HashMap<>();
        for (SocialSignal s : data.signals) {
            if (category.equalsIgnoreCase(s.category) && MetricsAggregator.inWindow(s, windowDays, now)) {
                postsByGrid.computeIfAbsent(s.gridId, k -> new ArrayList<>()).add(s);
            }
        }
        Map<String, List<BusinessRecord>> competitorsByGrid = new HashMap<>();
        for (BusinessRecord b : data.businesses) {
            if (category.equalsIgnoreCase(b.category)) {
                competitorsByGrid.computeIfAbsent(b.gridId, k -> new ArrayList<>()).add(b);
            }
        }
        int explainErrors = 0;
        for (GridWork w : top) {
            try {
                w.explanation = explainer.explain(
                        w.finalScore.score,
                        w.cell.center,
                        postsByGrid.getOrDefault(w.metrics.gridId, List.of()),
                        competitorsByGrid.getOrDefault(w.metrics.gridId, List.of()),
                        w.metrics.businessCount,
                        w.metrics.totalDemandSignals()
                );
            } catch (RuntimeException e) {
                explainErrors++;
                LOG.warn("evidence for grid {} unavailable: {}", w.metrics.gridId, e.getMessage());
                w.causes.add(DegradationCause.EXPLAIN_FAILED);
                w.explanation = Explanation.builder()
                        .rationale(explainer.rationale(w.finalScore.score, w.metrics.businessCount, w.metrics.totalDemandSignals()))
                        .build();
            }
        }
        telemetry.endStep(RunTelemetry.STEP_EXPLAIN, top.size(), top.size() - explainErrors, explainErrors);

        ctx.moveTo(PipelineState.DONE);
        Map<String, Long> timing = telemetry.timingMap();
        List<Recommendation> out = new ArrayList<>(top.size());
        for (GridWork w : top) {
            out.add(toRecommendation(w, category, mode, timing));
        }
        LOG.info("rank region={} category={} mode={} -> {} of {} grids in {}ms",
                region, category, mode.wireName(), out.size(), cells.size(), timing.get("total_ms"));
        return out;
    }

    private void assessGrids(List<GridWork> work, RequestContext ctx) {
        List<Future<Outcome<ContextualAssessment>>> futures = new ArrayList<>(work.size());
        for (GridWork w : work) {
            GeoPoint center = w.cell.center;
            futures.add(sweepExecutor.submit(() -> assessPoint(center, defaultRadiusM)));
        }
        try {
            for (int i = 0; i < work.size(); i++) {
                work.get(i).assessment = awaitCancellable(futures.get(i), ctx);
            }
        } catch (CancellationException e) {
            for (Future<?> future : futures) {
                future.cancel(true);
            }
            throw e;
        }
    }

    private Outcome<ContextualAssessment> assessPoint(GeoPoint center, double radiusM) {
        BusinessEnvironmentVector bev;
        try {
            bev = bevGenerator.generate(center, radiusM);
        } catch (RuntimeException e) {
            LOG.warn("no environment vector for {},{}: {}", center.lat(), center.lon(), e.getMessage());
            return Outcome.failure(DegradationCause.CONTEXTUAL_ERROR, "environment vector unavailable: " + e.getMessage());
        }
        return contextualGuard.assess(bev);
    }

    private <T> T awaitCancellable(Future<T> future, RequestContext ctx) {
        while (true) {
            ctx.checkNotCancelled();
            try {
                return future.get(CANCEL_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.trace("waiting on grid task for request {}", ctx.requestId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.cancel();
                ctx.checkNotCancelled();
            } catch (ExecutionException e) {
                throw new IllegalStateException("grid task failed unexpectedly", e.getCause());
            }
        }
    }

    private CategoryScore combineOne(
            CategoryScore ruleScore,
            Outcome<ContextualAssessment> assessment,
            ProcessingMode mode,
            Set<DegradationCause> causes
    ) {
        if (mode == ProcessingMode.FAST) {
            return combiner.combine(ruleScore, null, ProcessingMode.FAST);
        }
        if (assessment == null || !assessment.success) {
            causes.add(assessment == null ? DegradationCause.CONTEXTUAL_ERROR : assessment.cause);
            return combiner.combine(ruleScore, null, ProcessingMode.FULL);
        }
        if (assessment.value.probabilityFor(ruleScore.category).isEmpty()) {
            causes.add(DegradationCause.CONTEXTUAL_MISSING_CATEGORY);
        }
        return combiner.combine(ruleScore, assessment.value, ProcessingMode.FULL);
    }

    private Recommendation toRecommendation(GridWork w, String category, ProcessingMode mode, Map<String, Long> timing) {
        Map<String, CategoryScore> scores = new LinkedHashMap<>();
        scores.put(category, w.finalScore);
        ContextualAssessment opinion = successfulOpinion(w.assessment);
        return Recommendation.builder()
                .id(w.metrics.gridId)
                .gridId(w.metrics.gridId)
                .lat(w.cell.center.lat())
                .lon(w.cell.center.lon())
                .categoryScores(scores)
                .bestCategory(category)
                .rationale(w.explanation.rationale)
                .message(ScoreCombiner.tierMessage(w.finalScore.suitability, category))
                .topPosts(w.explanation.topPosts)
                .competitors(w.explanation.competitors)
                .processingMode(mode)
                .timing(timing)
                .confidence(w.confidence)
                .lowConfidence(w.causes.stream().anyMatch(DegradationCause::lowersConfidence))
                .ruleOnly(w.finalScore.ruleOnly)
                .degradedReasons(w.causes.stream().map(DegradationCause::wireName).toList())
                .modelUsed(opinion == null ? null : opinion.evaluator)
                .keyFactors(opinion == null ? List.of() : opinion.keyFactors)
                .risks(opinion == null ? List.of() : opinion.risks)
                .contextualRecommendation(opinion == null ? null : opinion.recommendation)
                .build();
    }

    // ---------------------------------------------------------------- point query

    public Recommendation evaluate(double lat, double lon, double radiusM, ProcessingMode mode) {
        return evaluate(lat, lon, radiusM, mode, new RequestContext(mode.wireName()));
    }

    public Recommendation evaluate(double lat, double lon, ProcessingMode mode) {
        return evaluate(lat, lon, defaultRadiusM, mode);
    }

    public Recommendation evaluate(double lat, double lon, double radiusM, ProcessingMode mode, RequestContext ctx) {
        if (!(lat >= -90.0 && lat <= 90.0) || !(lon >= -180.0 && lon <= 180.0)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "coordinate out of range: %s, %s", lat, lon));
        }
        if (!(radiusM > 0.0)) {
            throw new IllegalArgumentException("radius must be positive, got " + radiusM);
        }
        reloadLock.readLock().lock();
        try {
            return pointQuery(gridIndex, ruleBook, new GeoPoint(lat, lon), radiusM, mode, ctx);
        } finally {
            reloadLock.readLock().unlock();
        }
    }

    /**
     * Scores several locations one after another. A location that cannot be scored is logged and
     * left out, so the result may be shorter than {@code points}.
     */
    public List<Recommendation> evaluateBatch(List<GeoPoint> points, double radiusM, ProcessingMode mode) {
        List<Recommendation> out = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            try {
                out.add(evaluate(point.lat(), point.lon(), radiusM, mode));
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("batch skipped location {},{}: {}", point.lat(), point.lon(), e.getMessage());
            }
        }
        if (out.size() < points.size()) {
            LOG.warn("batch scored {} of {} locations", out.size(), points.size());
        }
        return out;
    }

    private Recommendation pointQuery(
            GridIndex index,
            RuleBook book,
            GeoPoint point,
            double radiusM,
            ProcessingMode mode,
            RequestContext ctx
    ) {
        RunTelemetry telemetry = ctx.telemetry();
        Set<DegradationCause> causes = EnumSet.noneOf(DegradationCause.class);

        ctx.moveTo(PipelineState.AGGREGATING);
        telemetry.startStep(RunTelemetry.STEP_BEV);
        BusinessEnvironmentVector bev;
        try {
            bev = bevGenerator.generate(point, radiusM);
        } catch (UpstreamUnavailableException e) {
            LOG.warn("business source unavailable for point {},{}: {}", point.lat(), point.lon(), e.getMessage());
            causes.add(DegradationCause.BUSINESS_SOURCE_UNAVAILABLE);
            bev = BevGenerator.empty(point, radiusM);
        }
        telemetry.endStep(RunTelemetry.STEP_BEV, 1, bev.totalBusinesses, causes.size());

        ctx.moveTo(PipelineState.RULE_SCORING);
        telemetry.startStep(RunTelemetry.STEP_RULE);
        Map<String, CategoryScore> ruleScores = new LinkedHashMap<>();
        for (String category : categories) {
            ruleScores.put(category, ruleEngine.evaluate(book.table(category), bev, category));
        }
        telemetry.endStep(RunTelemetry.STEP_RULE, categories.size(), ruleScores.size(), 0);

        Outcome<ContextualAssessment> assessment = null;
        if (mode == ProcessingMode.FULL) {
            ctx.moveTo(PipelineState.CONTEXTUAL_PENDING);
            telemetry.startStep(RunTelemetry.STEP_LLM);
            assessment = contextualGuard.assess(bev);
            telemetry.endStep(RunTelemetry.STEP_LLM, 1, assessment.success ? 1 : 0, assessment.success ? 0 : 1, assessment.message);
            ctx.checkNotCancelled();
        }

        ctx.moveTo(PipelineState.COMBINING);
        telemetry.startStep(RunTelemetry.STEP_COMBINE);
        Map<String, CategoryScore> finalScores = new LinkedHashMap<>();
        String best = null;
        for (String category : categories) {
            CategoryScore combined = combineOne(ruleScores.get(category), assessment, mode, causes);
            finalScores.put(category, combined);
            if (best == null || combined.score > finalScores.get(best).score) {
                best = category;
            }
        }
        telemetry.endStep(RunTelemetry.STEP_COMBINE, ruleScores.size(), finalScores.size(), 0);

        ctx.moveTo(PipelineState.EXPLAINING);
        telemetry.startStep(RunTelemetry.STEP_EXPLAIN);
        List<BusinessRecord> competitors = fetchNearOrEmpty(best, point, radiusM, causes);
        List<SocialSignal> posts = postsNear(best, point, radiusM, causes);
        int demand = posts.size();
        int mentions = (int) posts.stream().filter(s -> s.type == SignalType.MENTION).count();
        CategoryScore bestScore = finalScores.get(best);
        Explanation explanation = explainer.explain(bestScore.score, point, posts, competitors, competitors.size(), demand);
        telemetry.endStep(RunTelemetry.STEP_EXPLAIN, posts.size() + competitors.size(),
                explanation.topPosts.size() + explanation.competitors.size(), 0);
        if (demand == 0) {
            causes.add(DegradationCause.NO_DEMAND_SIGNALS);
        }

        ctx.moveTo(PipelineState.DONE);
        Optional<GridCell> cell = index.assign(point.lat(), point.lon());
        String id = cell.map(c -> c.id).orElse(String.format(Locale.ROOT, "point-%.5f-%.5f", point.lat(), point.lon()));
        boolean ruleOnly = finalScores.values().stream().allMatch(s -> s.ruleOnly);
        ContextualAssessment opinion = successfulOpinion(assessment);
        return Recommendation.builder()
                .id(id)
                .gridId(cell.map(c -> c.id).orElse(null))
                .lat(point.lat())
                .lon(point.lon())
                .categoryScores(finalScores)
                .bestCategory(best)
                .rationale(explanation.rationale)
                .message(ScoreCombiner.tierMessage(bestScore.suitability, best))
                .topPosts(explanation.topPosts)
                .competitors(explanation.competitors)
                .processingMode(mode)
                .timing(telemetry.timingMap())
                .confidence(ConfidenceCalculator.confidence(mentions, demand - mentions))
                .lowConfidence(causes.stream().anyMatch(DegradationCause::lowersConfidence))
                .ruleOnly(ruleOnly)
                .degradedReasons(causes.stream().map(DegradationCause::wireName).toList())
                .totalBusinessesNearby(bev.totalBusinesses)
                .modelUsed(opinion == null ? null : opinion.evaluator)
                .keyFactors(opinion == null ? List.of() : opinion.keyFactors)
                .risks(opinion == null ? List.of() : opinion.risks)
                .contextualRecommendation(opinion == null ? null : opinion.recommendation)
                .build();
    }

    private static ContextualAssessment successfulOpinion(Outcome<ContextualAssessment> assessment) {
        return assessment != null && assessment.success ? assessment.value : null;
    }

    private List<BusinessRecord> fetchNearOrEmpty(String category, GeoPoint point, double radiusM, Set<DegradationCause> causes) {
        try {
            return businessSource.fetchNear(category, point, radiusM);
        } catch (UpstreamUnavailableException e) {
            LOG.warn("competitors for {} unavailable: {}", category, e.getMessage());
            causes.add(DegradationCause.BUSINESS_SOURCE_UNAVAILABLE);
            return List.of();
        }
    }

    private List<SocialSignal> postsNear(String category, GeoPoint point, double radiusM, Set<DegradationCause> causes) {
        double dLat = GeoMath.metersToLatDegrees(radiusM);
        double dLon = GeoMath.metersToLonDegrees(radiusM, point.lat());
        BoundingBox box = new BoundingBox(point.lat() + dLat, point.lat() - dLat, point.lon() + dLon, point.lon() - dLon);
        List<SocialSignal> raw;
        try {
            raw = socialSource.fetch(category, box, windowDays);
        } catch (UpstreamUnavailableException e) {
            LOG.warn("posts for {} unavailable: {}", category, e.getMessage());
            causes.add(DegradationCause.SOCIAL_SOURCE_UNAVAILABLE);
            return List.of();
        }
        Instant now = clock.instant();
        List<SocialSignal> out = new ArrayList<>();
        for (SocialSignal s : raw) {
            if (s.hasLocation()
                    && GeoMath.haversineMeters(point.lat(), point.lon(), s.lat, s.lon) <= radiusM
                    && MetricsAggregator.inWindow(s, windowDays, now)) {
                out.add(s);
            }
        }
        return out;
    }

    // ---------------------------------------------------------------- explain

    public Explanation explain(String gridId, String category) {
        String wanted = requireCategory(category);
        reloadLock.readLock().lock();
        try {
            GridIndex index = gridIndex;
            GridCell cell = index.cell(gridId);
            Set<DegradationCause> causes = EnumSet.noneOf(DegradationCause.class);
            BoundingBox bounds = index.bounds(cell.region);
            RegionData data = loadRegion(index, cell.region, wanted, bounds, causes);
            Instant now = clock.instant();
            List<String> ids = index.cells(cell.region).stream().map(c -> c.id).toList();
            List<GridMetrics> normalized = normalizer.normalizeAll(
                    aggregator.aggregate(wanted, ids, data.businesses, data.signals, windowDays, now));
            GridMetrics metrics = normalized.stream()
                    .filter(m -> m.gridId.equals(cell.id))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("no metrics for grid " + gridId));
            CategoryScore score = ruleEngine.evaluate(ruleBook.table(RuleBook.GRID_TABLE), metrics, wanted);

            List<SocialSignal> posts = data.signals.stream()
                    .filter(s -> cell.id.equals(s.gridId) && wanted.equalsIgnoreCase(s.category)
                            && MetricsAggregator.inWindow(s, windowDays, now))
                    .toList();
            List<BusinessRecord> competitors = data.businesses.stream()
                    .filter(b -> cell.id.equals(b.gridId) && wanted.equalsIgnoreCase(b.category))
                    .toList();
            if (!causes.isEmpty()) {
                LOG.warn("explanation for {} built from partial data: {}", gridId, causes);
            }
            return explainer.explain(score.score, cell.center, posts, competitors, metrics.businessCount, metrics.totalDemandSignals());
        } finally {
            reloadLock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- shared

    private RegionData loadRegion(GridIndex index, String region, String category, BoundingBox bounds, Set<DegradationCause> causes) {
        List<BusinessRecord> businesses;
        try {
            businesses = businessSource.fetch(category, bounds);
        } catch (UpstreamUnavailableException e) {
            LOG.warn("business source unavailable for region {}: {}", region, e.getMessage());
            causes.add(DegradationCause.BUSINESS_SOURCE_UNAVAILABLE);
            businesses = List.of();
        }
        List<SocialSignal> signals;
        try {
            signals = socialSource.fetch(category, bounds, windowDays);
        } catch (UpstreamUnavailableException e) {
            LOG.warn("social source unavailable for region {}: {}", region, e.getMessage());
            causes.add(DegradationCause.SOCIAL_SOURCE_UNAVAILABLE);
            signals = List.of();
        }
        return new RegionData(assignBusinesses(index, region, businesses), assignSignals(index, region, signals));
    }

    private List<BusinessRecord> assignBusinesses(GridIndex index, String region, Collection<BusinessRecord> records) {
        List<BusinessRecord> out = new ArrayList<>(records.size());
        int outside = 0;
        for (BusinessRecord b : records) {
            if (belongsTo(index, region, b.gridId)) {
                out.add(b);
                continue;
            }
            Optional<GridCell> cell = index.assign(region, b.lat, b.lon);
            if (cell.isPresent()) {
                out.add(b.toBuilder().gridId(cell.get().id).build());
            } else {
                outside++;
            }
        }
        if (outside > 0) {
            LOG.debug("{} businesses fall outside region {}", outside, region);
        }
        return out;
    }

    private List<SocialSignal> assignSignals(GridIndex index, String region, Collection<SocialSignal> signals) {
        List<SocialSignal> out = new ArrayList<>(signals.size());
        int outside = 0;
        for (SocialSignal s : signals) {
            if (belongsTo(index, region, s.gridId)) {
                out.add(s);
                continue;
            }
            Optional<GridCell> cell = s.hasLocation() ? index.assign(region, s.lat, s.lon) : Optional.empty();
            if (cell.isPresent()) {
                out.add(s.toBuilder().gridId(cell.get().id).build());
            } else {
                outside++;
            }
        }
        if (outside > 0) {
            LOG.debug("{} posts fall outside region {}", outside, region);
        }
        return out;
    }

    private static boolean belongsTo(GridIndex index, String region, String gridId) {
        return gridId != null && index.find(gridId).map(c -> c.region.equals(region)).orElse(false);
    }

    private String requireCategory(String category) {
        if (category != null) {
            for (String known : categories) {
                if (known.equalsIgnoreCase(category.trim())) {
                    return known;
                }
            }
        }
        throw new NotFoundException("unknown category: " + category);
    }

    private static void validateRuleBook(RuleBook book, List<String> categories) {
        if (!book.has(RuleBook.GRID_TABLE)) {
            throw new ConfigurationException("rule book has no '" + RuleBook.GRID_TABLE + "' table");
        }
        for (String category : categories) {
            if (!book.has(category)) {
                throw new ConfigurationException("rule book has no table for category " + category);
            }
        }
    }

    @Override
    public void close() {
        sweepExecutor.shutdownNow();
        contextualGuard.close();
    }

    private record RegionData(List<BusinessRecord> businesses, List<SocialSignal> signals) {
    }

    private static final class GridWork {
        private final GridCell cell;
        private final GridMetrics metrics;
        private final CategoryScore ruleScore;
        private final Set<DegradationCause> causes = EnumSet.noneOf(DegradationCause.class);
        private Outcome<ContextualAssessment> assessment;
        private CategoryScore finalScore;
        private double confidence;
        private Explanation explanation = Explanation.EMPTY;

        private GridWork(GridCell cell, GridMetrics metrics, CategoryScore ruleScore) {
            this.cell = cell;
            this.metrics = metrics;
            this.ruleScore = ruleScore;
        }
    }
}

package com.paperradar.ranking.engine;

import com.paperradar.common.baseline.BaselineEstimator;
import com.paperradar.common.baseline.BaselineSnapshot;
import com.paperradar.common.collaborator.EmbeddingProvider;
import com.paperradar.common.collaborator.PopulationSource;
import com.paperradar.common.collaborator.ScorePersistence;
import com.paperradar.common.exception.PopulationUnavailableException;
import com.paperradar.common.exception.RankingException;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.model.RankedList;
import com.paperradar.common.model.ScoreBreakdown;
import com.paperradar.common.model.VolatilityClass;
import com.paperradar.common.scoring.NoveltyEstimator;
import com.paperradar.common.scoring.RankingOrder;
import com.paperradar.common.scoring.ScoreCalculator;
import com.paperradar.common.scoring.ScoringContext;
import com.paperradar.common.scoring.ScoringPolicy;
import com.paperradar.common.similarity.SimilarityIndex;
import com.paperradar.common.time.Deadline;
import com.paperradar.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one ranking cycle over the population a {@link PopulationSource} supplies.
 *
 * <p>Pipeline:
 * <pre>
 *   fetch population (deadline-bounded; failure escalates)
 *     → load missing embeddings into the similarity index (optional, errors absorbed)
 *     → compute field baselines                      (barrier: nothing is scored before)
 *     → score artifacts on the worker scheduler      (bounded by parallelism and deadline)
 *         each: cache score:&lt;id&gt; as DERIVED_METRICS, persist (failures counted)
 *     → write ranking:top (DERIVED_METRICS) and ranking:trending (TRENDING)
 * </pre>
 *
 * <p>Only a missing population escalates. Malformed artifacts and persistence failures are
 * counted in the {@link CycleReport}: a failure share above the configured ratio makes the
 * cycle {@link CycleStatus#DEGRADED}; hitting the deadline makes it
 * {@link CycleStatus#PARTIAL}, keeps the per-artifact entries already written and leaves the
 * previous cycle's ranked lists in place.
 *
 * <p>Each cycle id doubles as the trace id of its log lines.
 */
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    public static final String SCORE_KEY_PREFIX = "score:";
    public static final String TOP_KEY = "ranking:top";
    public static final String TRENDING_KEY = "ranking:trending";
    static final String EMBEDDING_KEY_PREFIX = "embedding:";

    private final BaselineEstimator baselineEstimator;
    private final ScoringPolicy scoringPolicy;
    private final CyclePolicy cyclePolicy;
    private final RankingCaches caches;
    private final ScorePersistence persistence;
    private final SimilarityIndex similarityIndex;
    private final EmbeddingProvider embeddingProvider;
    private final Scheduler workers;
    private final Clock clock;

    private volatile ScoringSnapshot lastScoring;

    /**
     * @param similarityIndex   nullable; keyword-only novelty without it
     * @param embeddingProvider nullable; the index is not fed without it
     */
    public RankingEngine(BaselineEstimator baselineEstimator, ScoringPolicy scoringPolicy, CyclePolicy cyclePolicy,
                         RankingCaches caches, ScorePersistence persistence, SimilarityIndex similarityIndex,
                         EmbeddingProvider embeddingProvider, Scheduler workers, Clock clock) {
        this.baselineEstimator = baselineEstimator;
        this.scoringPolicy = scoringPolicy;
        this.cyclePolicy = cyclePolicy;
        this.caches = caches;
        this.persistence = persistence;
        this.similarityIndex = similarityIndex;
        this.embeddingProvider = embeddingProvider;
        this.workers = workers;
        this.clock = clock;
    }

    public static String scoreKey(String artifactId) {
        return SCORE_KEY_PREFIX + artifactId;
    }

    public CyclePolicy cyclePolicy() {
        return cyclePolicy;
    }

    /** Runs a cycle with the configured deadline, starting when subscribed. */
    public Mono<CycleReport> runCycle(String cycleId, PopulationSource source) {
        return Mono.defer(() -> runCycle(cycleId, source, Deadline.after(cyclePolicy.deadline(), clock)));
    }

    public Mono<CycleReport> runCycle(String cycleId, PopulationSource source, Deadline deadline) {
        Mono<CycleReport> pipeline = Mono.defer(() -> {
            Instant startedAt = clock.instant();
            TraceContextUtil.withMdc(cycleId, () ->
                log.info("CYCLE_START cycleId={} deadline={}", cycleId, deadline.expiresAt()));
            return fetchPopulation(source, deadline)
                .flatMap(population -> loadEmbeddings(cycleId, population, deadline).thenReturn(population))
                .flatMap(population -> scorePopulation(cycleId, population, startedAt, deadline));
        });
        return TraceContextUtil.withTraceId(pipeline, cycleId);
    }

    /**
     * Scores one artifact against the baselines and reference time of the last cycle.
     * Used by the read path to refill a missing score between cycles.
     */
    public Mono<ScoreBreakdown> scoreOnDemand(ArtifactMetrics artifact) {
        return Mono.defer(() -> {
            ScoringSnapshot snapshot = lastScoring;
            if (snapshot == null) {
                return Mono.error(new RankingException("ranking-engine", "no cycle has computed baselines yet"));
            }
            return Mono.fromCallable(() -> snapshot.calculator()
                    .score(artifact, snapshot.baselines().forCategory(artifact.category())))
                .subscribeOn(workers);
        });
    }

    // ── stages ──────────────────────────────────────────────────────────────

    private Mono<List<ArtifactMetrics>> fetchPopulation(PopulationSource source, Deadline deadline) {
        Mono<List<ArtifactMetrics>> fetch = Mono.defer(() -> source.fetchPopulation(deadline));
        if (deadline.isBounded()) fetch = fetch.timeout(deadline.remaining(clock));
        return fetch
            .defaultIfEmpty(List.of())
            .onErrorMap(e -> !(e instanceof PopulationUnavailableException),
                e -> new PopulationUnavailableException(source.getClass().getSimpleName(), e));
    }

    /**
     * Prunes the index to the current population, then loads the vectors it lacks. Provider
     * failures leave the artifact on keyword novelty; vectors the index refuses are counted
     * and logged at warn.
     */
    private Mono<Void> loadEmbeddings(String cycleId, List<ArtifactMetrics> population, Deadline deadline) {
        if (similarityIndex == null || embeddingProvider == null) return Mono.empty();
        Set<String> windowIds = population.stream()
            .map(ArtifactMetrics::id)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        int pruned = similarityIndex.retainOnly(windowIds);
        AtomicInteger loaded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        return Flux.fromIterable(population)
            .filter(a -> a.id() != null && similarityIndex.vectorOf(a.id()).isEmpty())
            .flatMap(a -> caches.embeddings()
                .getOrCompute(EMBEDDING_KEY_PREFIX + a.id(), VolatilityClass.EMBEDDINGS,
                    () -> embeddingProvider.embeddingFor(a, deadline), deadline.remaining(clock))
                .onErrorResume(e -> {
                    log.debug("EMBEDDING_SKIPPED cycleId={} artifactId={} reason={}", cycleId, a.id(), e.getMessage());
                    return Mono.empty();
                })
                .doOnNext(vector -> {
                    try {
                        similarityIndex.upsert(a.id(), vector);
                        loaded.incrementAndGet();
                    } catch (RuntimeException e) {
                        rejected.incrementAndGet();
                        TraceContextUtil.withMdc(cycleId, () ->
                            log.warn("EMBEDDING_INDEX_REJECTED cycleId={} artifactId={} indexSize={} error={}",
                                cycleId, a.id(), similarityIndex.size(), e.toString()));
                    }
                }), cyclePolicy.parallelism())
            .takeUntilOther(deadlineSignal(deadline))
            .then(Mono.fromRunnable(() -> TraceContextUtil.withMdc(cycleId, () ->
                log.info("EMBEDDINGS_LOADED cycleId={} loaded={} pruned={} rejected={} indexSize={}",
                    cycleId, loaded.get(), pruned, rejected.get(), similarityIndex.size()))));
    }

    private Mono<CycleReport> scorePopulation(String cycleId, List<ArtifactMetrics> population,
                                              Instant startedAt, Deadline deadline) {
        BaselineSnapshot baselines = baselineEstimator.computeBaselines(population, startedAt);
        NoveltyEstimator novelty = NoveltyEstimator.build(population, similarityIndex, scoringPolicy.novelty());
        ScoreCalculator calculator = new ScoreCalculator(scoringPolicy, new ScoringContext(startedAt, novelty));
        CycleCounters counters = new CycleCounters();
        AtomicBoolean deadlineHit = new AtomicBoolean();

        return Flux.fromIterable(population)
            .flatMap(a -> scoreOne(cycleId, calculator, baselines, a, counters), cyclePolicy.parallelism())
            .takeUntilOther(deadlineSignal(deadline).doOnNext(tick -> deadlineHit.set(true)))
            .collectList()
            .map(scored -> {
                lastScoring = new ScoringSnapshot(baselines, calculator);
                return finish(cycleId, population, scored, baselines, counters, deadlineHit.get(), startedAt);
            });
    }

    private Mono<ScoreBreakdown> scoreOne(String cycleId, ScoreCalculator calculator, BaselineSnapshot baselines,
                                          ArtifactMetrics artifact, CycleCounters counters) {
        return Mono.fromCallable(() -> calculator.score(artifact, baselines.forCategory(artifact.category())))
            .subscribeOn(workers)
            .doOnNext(score -> caches.scores().put(scoreKey(score.artifactId()), score, VolatilityClass.DERIVED_METRICS))
            .flatMap(score -> persistence.save(score)
                .onErrorResume(e -> {
                    counters.persistFailures.incrementAndGet();
                    TraceContextUtil.withMdc(cycleId, () ->
                        log.warn("SCORE_PERSIST_FAILED cycleId={} artifactId={} error={}",
                            cycleId, score.artifactId(), e.getMessage()));
                    return Mono.empty();
                })
                .thenReturn(score))
            .onErrorResume(e -> {
                counters.failed.incrementAndGet();
                TraceContextUtil.withMdc(cycleId, () ->
                    log.warn("ARTIFACT_SKIPPED cycleId={} artifactId={} error={}", cycleId, artifact.id(), e.getMessage()));
                return Mono.empty();
            });
    }

    private CycleReport finish(String cycleId, List<ArtifactMetrics> population, List<ScoreBreakdown> scored,
                               BaselineSnapshot baselines, CycleCounters counters, boolean deadlineHit,
                               Instant startedAt) {
        int failed = counters.failed.get();
        CycleStatus status;
        if (deadlineHit) {
            status = CycleStatus.PARTIAL;
        } else if (!population.isEmpty()
                && (double) failed / population.size() > cyclePolicy.degradedFailureRatio()) {
            status = CycleStatus.DEGRADED;
        } else {
            status = CycleStatus.COMPLETED;
        }

        if (status != CycleStatus.PARTIAL) writeRankings(cycleId, population, scored, startedAt);

        CycleReport report = new CycleReport(cycleId, status, population.size(), scored.size(), failed,
            counters.persistFailures.get(), baselines.insufficientCategories(), startedAt, clock.instant());
        TraceContextUtil.withMdc(cycleId, () ->
            log.info("CYCLE_COMPLETE cycleId={} status={} population={} scored={} failed={} persistFailures={} durationMs={}",
                cycleId, status, report.populationSize(), report.scored(), report.failed(),
                report.persistFailures(), report.durationMs()));
        return report;
    }

    private void writeRankings(String cycleId, List<ArtifactMetrics> population, List<ScoreBreakdown> scored,
                               Instant startedAt) {
        Map<String, ArtifactMetrics> artifacts = population.stream()
            .filter(a -> a.id() != null)
            .collect(Collectors.toMap(ArtifactMetrics::id, Function.identity(), (first, second) -> second,
                LinkedHashMap::new));
        List<ScoreBreakdown> unique = List.copyOf(scored.stream()
            .collect(Collectors.toMap(ScoreBreakdown::artifactId, Function.identity(), (first, second) -> second,
                LinkedHashMap::new))
            .values());

        Duration freshWindow = scoringPolicy.freshness().ageThreshold();
        RankedList top = RankingOrder.rank(cycleId, startedAt, unique, artifacts, s -> true, cyclePolicy.topN());
        RankedList trending = RankingOrder.rank(cycleId, startedAt, unique, artifacts,
            s -> Duration.between(artifacts.get(s.artifactId()).publishedAt(), startedAt).compareTo(freshWindow) < 0,
            cyclePolicy.trendingN());

        caches.rankings().put(TOP_KEY, top, VolatilityClass.DERIVED_METRICS);
        caches.rankings().put(TRENDING_KEY, trending, VolatilityClass.TRENDING);
    }

    private Mono<Long> deadlineSignal(Deadline deadline) {
        if (!deadline.isBounded()) return Mono.never();
        return Mono.defer(() -> Mono.delay(deadline.remaining(clock)));
    }

    private record ScoringSnapshot(BaselineSnapshot baselines, ScoreCalculator calculator) {}

    private static final class CycleCounters {
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger persistFailures = new AtomicInteger();
    }
}

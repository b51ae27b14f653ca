package com.paperradar.ranking.read;

import com.paperradar.common.cache.CachedValue;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.model.RankedEntry;
import com.paperradar.common.model.RankedList;
import com.paperradar.common.model.ScoreBreakdown;
import com.paperradar.common.model.VolatilityClass;
import com.paperradar.ranking.engine.RankingCaches;
import com.paperradar.ranking.engine.RankingEngine;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read path over the caches the cycle fills.
 *
 * <p>Lookups serve expired entries flagged {@code stale} rather than nothing: a missed cycle
 * should degrade freshness, not availability. Only {@link #scoreOrCompute} computes, and it
 * goes through the cache's single-flight so concurrent requests share one computation.
 */
@Service
public class ScoreReadService {

    private final RankingCaches caches;
    private final RankingEngine engine;

    public ScoreReadService(RankingCaches caches, RankingEngine engine) {
        this.caches = caches;
        this.engine = engine;
    }

    public Mono<CachedValue<ScoreBreakdown>> scoreFor(String artifactId) {
        return Mono.justOrEmpty(caches.scores().getAllowingStale(RankingEngine.scoreKey(artifactId)));
    }

    public Mono<ScoreBreakdown> scoreOrCompute(ArtifactMetrics artifact) {
        return caches.scores().getOrCompute(RankingEngine.scoreKey(artifact.id()), VolatilityClass.DERIVED_METRICS,
            () -> engine.scoreOnDemand(artifact));
    }

    public Mono<CachedValue<RankedList>> topRanking(int limit) {
        return ranked(RankingEngine.TOP_KEY, limit);
    }

    public Mono<CachedValue<RankedList>> trending(int limit) {
        return ranked(RankingEngine.TRENDING_KEY, limit);
    }

    private Mono<CachedValue<RankedList>> ranked(String key, int limit) {
        return Mono.justOrEmpty(caches.rankings().getAllowingStale(key))
            .map(cached -> limit <= 0 || cached.value().entries().size() <= limit ? cached : truncate(cached, limit));
    }

    private static CachedValue<RankedList> truncate(CachedValue<RankedList> cached, int limit) {
        RankedList list = cached.value();
        List<RankedEntry> head = list.entries().subList(0, limit);
        return new CachedValue<>(new RankedList(list.cycleId(), list.computedAt(), head),
            cached.volatilityClass(), cached.storedAt(), cached.expiresAt(), cached.age(), cached.stale());
    }
}

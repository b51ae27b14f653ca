package com.paperradar.ranking.engine;

import com.paperradar.common.cache.CacheStats;
import com.paperradar.common.cache.VolatilityCache;
import com.paperradar.common.model.RankedList;
import com.paperradar.common.model.ScoreBreakdown;

import java.util.List;

/** The three typed caches the ranking pipeline writes through. */
public record RankingCaches(
    VolatilityCache<ScoreBreakdown> scores,
    VolatilityCache<RankedList> rankings,
    VolatilityCache<float[]> embeddings
) {

    public List<VolatilityCache<?>> all() {
        return List.of(scores, rankings, embeddings);
    }

    public List<CacheStats> stats() {
        return all().stream().map(VolatilityCache::stats).toList();
    }
}

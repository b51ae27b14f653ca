package com.paperradar.ranking.config;

import com.paperradar.common.baseline.BaselineEstimator;
import com.paperradar.common.cache.CachePolicy;
import com.paperradar.common.cache.VolatilityCache;
import com.paperradar.common.collaborator.EmbeddingProvider;
import com.paperradar.common.collaborator.PopulationSource;
import com.paperradar.common.collaborator.ScorePersistence;
import com.paperradar.common.model.RankedList;
import com.paperradar.common.model.ScoreBreakdown;
import com.paperradar.common.ratelimit.RateLimiter;
import com.paperradar.common.scoring.ScoringPolicy;
import com.paperradar.common.similarity.HnswSimilarityIndex;
import com.paperradar.common.similarity.InMemorySimilarityIndex;
import com.paperradar.common.similarity.SimilarityIndex;
import com.paperradar.ranking.client.HttpEmbeddingProvider;
import com.paperradar.ranking.client.HttpPopulationSource;
import com.paperradar.ranking.client.HttpScorePersistence;
import com.paperradar.ranking.client.ProviderGateway;
import com.paperradar.ranking.engine.CyclePolicy;
import com.paperradar.ranking.engine.RankingCaches;
import com.paperradar.ranking.engine.RankingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires the ranking pipeline from {@link RankingProperties}. Every policy record validates
 * itself on construction, so misconfiguration stops the context from starting.
 */
@Configuration
@EnableConfigurationProperties(RankingProperties.class)
public class RankingConfig {

    private static final Logger log = LoggerFactory.getLogger(RankingConfig.class);

    @Bean
    public Clock rankingClock() {
        return Clock.systemUTC();
    }

    // ── policies ────────────────────────────────────────────────────────────

    @Bean
    public ScoringPolicy scoringPolicy(RankingProperties properties) {
        return properties.toScoringPolicy();
    }

    @Bean
    public CyclePolicy cyclePolicy(RankingProperties properties) {
        return properties.toCyclePolicy();
    }

    @Bean
    public CachePolicy cachePolicy(RankingProperties properties) {
        return properties.toCachePolicy();
    }

    @Bean
    public BaselineEstimator baselineEstimator(RankingProperties properties) {
        return new BaselineEstimator(properties.toBaselinePolicy());
    }

    @Bean
    public RateLimiter rateLimiter(RankingProperties properties, Clock rankingClock) {
        return new RateLimiter(properties.toRateLimitPolicy(), rankingClock);
    }

    // ── caches ──────────────────────────────────────────────────────────────

    @Bean
    public RankingCaches rankingCaches(CachePolicy cachePolicy, Clock rankingClock) {
        return new RankingCaches(
            new VolatilityCache<ScoreBreakdown>("scores", cachePolicy, rankingClock),
            new VolatilityCache<RankedList>("rankings", cachePolicy, rankingClock),
            new VolatilityCache<float[]>("embeddings", cachePolicy, rankingClock));
    }

    // ── similarity ──────────────────────────────────────────────────────────

    /** {@code ranking.similarity.engine=none} leaves novelty keyword-only. */
    @Bean
    @ConditionalOnProperty(prefix = "ranking.similarity", name = "engine", havingValue = "memory", matchIfMissing = true)
    public SimilarityIndex inMemorySimilarityIndex(RankingProperties properties) {
        log.info("SIMILARITY_INDEX engine=memory dimension={}", properties.getSimilarity().getDimension());
        return new InMemorySimilarityIndex(properties.getSimilarity().getDimension());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ranking.similarity", name = "engine", havingValue = "hnsw")
    public SimilarityIndex hnswSimilarityIndex(RankingProperties properties) {
        RankingProperties.Similarity similarity = properties.getSimilarity();
        log.info("SIMILARITY_INDEX engine=hnsw dimension={} maxItems={}", similarity.getDimension(), similarity.getMaxItems());
        return new HnswSimilarityIndex(similarity.getDimension(), similarity.getMaxItems());
    }

    // ── collaborators ───────────────────────────────────────────────────────

    @Bean
    public ProviderGateway providerGateway(RateLimiter rateLimiter, Clock rankingClock) {
        return new ProviderGateway(rateLimiter, rankingClock);
    }

    @Bean
    public PopulationSource populationSource(@Qualifier("catalogWebClient") WebClient catalogWebClient,
                                             ProviderGateway providerGateway, RankingProperties properties) {
        return new HttpPopulationSource(catalogWebClient, providerGateway, properties.getBaseline().getWindowDays());
    }

    @Bean
    public ScorePersistence scorePersistence(@Qualifier("scoresWebClient") WebClient scoresWebClient,
                                             ProviderGateway providerGateway) {
        return new HttpScorePersistence(scoresWebClient, providerGateway);
    }

    @Bean
    public EmbeddingProvider embeddingProvider(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                               ProviderGateway providerGateway) {
        return new HttpEmbeddingProvider(embeddingsWebClient, providerGateway);
    }

    // ── engine ──────────────────────────────────────────────────────────────

    @Bean(destroyMethod = "dispose")
    public Scheduler rankingWorkers(CyclePolicy cyclePolicy) {
        return Schedulers.newParallel("ranking-worker", cyclePolicy.parallelism());
    }

    @Bean
    public RankingEngine rankingEngine(BaselineEstimator baselineEstimator, ScoringPolicy scoringPolicy,
                                       CyclePolicy cyclePolicy, RankingCaches rankingCaches,
                                       ScorePersistence scorePersistence,
                                       ObjectProvider<SimilarityIndex> similarityIndex,
                                       ObjectProvider<EmbeddingProvider> embeddingProvider,
                                       Scheduler rankingWorkers, Clock rankingClock) {
        return new RankingEngine(baselineEstimator, scoringPolicy, cyclePolicy, rankingCaches, scorePersistence,
            similarityIndex.getIfAvailable(), embeddingProvider.getIfAvailable(), rankingWorkers, rankingClock);
    }
}

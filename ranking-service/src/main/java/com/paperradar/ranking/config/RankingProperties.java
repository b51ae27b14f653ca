package com.paperradar.ranking.config;

import com.paperradar.common.baseline.BaselinePolicy;
import com.paperradar.common.cache.CachePolicy;
import com.paperradar.common.cache.TtlTable;
import com.paperradar.common.model.VolatilityClass;
import com.paperradar.common.ratelimit.ProviderLimitConfig;
import com.paperradar.common.ratelimit.RateLimitPolicy;
import com.paperradar.common.scoring.FreshnessPolicy;
import com.paperradar.common.scoring.NoveltyPolicy;
import com.paperradar.common.scoring.ScoreWeights;
import com.paperradar.common.scoring.ScoringPolicy;
import com.paperradar.ranking.engine.CyclePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw {@code ranking.*} settings as bound from {@code application.yml}.
 *
 * <p>Nothing reads these fields directly: {@link RankingConfig} converts them once into the
 * validated policy records, so a bad value fails startup instead of the first cycle.
 */
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    private final Weights weights = new Weights();
    private final Scoring scoring = new Scoring();
    private final Freshness freshness = new Freshness();
    private final Novelty novelty = new Novelty();
    private final RateLimit rateLimit = new RateLimit();
    private final Cache cache = new Cache();
    private final Baseline baseline = new Baseline();
    private final Cycle cycle = new Cycle();
    private final Similarity similarity = new Similarity();
    private final Services services = new Services();

    public Weights getWeights() { return weights; }
    public Scoring getScoring() { return scoring; }
    public Freshness getFreshness() { return freshness; }
    public Novelty getNovelty() { return novelty; }
    public RateLimit getRateLimit() { return rateLimit; }
    public Cache getCache() { return cache; }
    public Baseline getBaseline() { return baseline; }
    public Cycle getCycle() { return cycle; }
    public Similarity getSimilarity() { return similarity; }
    public Services getServices() { return services; }

    // ── conversion ──────────────────────────────────────────────────────────

    public ScoringPolicy toScoringPolicy() {
        ScoreWeights w = new ScoreWeights(weights.citationMomentum, weights.implementationQuality,
            weights.authorCredibility, weights.novelty, weights.reproducibility,
            weights.communityEngagement, weights.recency);
        FreshnessPolicy f = new FreshnessPolicy(freshness.ageThreshold, freshness.maxMultiplier, freshness.tractionFloor);
        NoveltyPolicy n = new NoveltyPolicy(novelty.semanticWeight, novelty.keywordWeight,
            novelty.fallbackDiscount, novelty.neighbours);
        return new ScoringPolicy(w, f, n, scoring.recencyHalfLife, scoring.neutralAuthorCredibility,
            scoring.codePresenceCredit);
    }

    public RateLimitPolicy toRateLimitPolicy() {
        Map<String, ProviderLimitConfig> providers = new LinkedHashMap<>();
        rateLimit.providers.forEach((name, p) -> providers.put(name, p.toConfig()));
        return new RateLimitPolicy(rateLimit.defaults.toConfig(), providers, rateLimit.maxWait,
            rateLimit.highPriorityOverrideBudget, rateLimit.lowPriorityReserveRatio, rateLimit.jitterRatio);
    }

    public CachePolicy toCachePolicy() {
        return new CachePolicy(new TtlTable(cache.ttl), cache.maxEntries, cache.purgeGrace, cache.singleFlightTimeout);
    }

    public BaselinePolicy toBaselinePolicy() {
        return new BaselinePolicy(baseline.windowDays, baseline.minSampleSize);
    }

    public CyclePolicy toCyclePolicy() {
        return new CyclePolicy(cycle.enabled, cycle.initialDelay, cycle.interval, cycle.deadline,
            cycle.parallelism, cycle.degradedFailureRatio, cycle.topN, cycle.trendingN);
    }

    // ── sections ────────────────────────────────────────────────────────────

    public static class Weights {
        private double citationMomentum = 0.25;
        private double implementationQuality = 0.20;
        private double authorCredibility = 0.15;
        private double novelty = 0.15;
        private double reproducibility = 0.10;
        private double communityEngagement = 0.10;
        private double recency = 0.05;

        public double getCitationMomentum() { return citationMomentum; }
        public void setCitationMomentum(double citationMomentum) { this.citationMomentum = citationMomentum; }
        public double getImplementationQuality() { return implementationQuality; }
        public void setImplementationQuality(double implementationQuality) { this.implementationQuality = implementationQuality; }
        public double getAuthorCredibility() { return authorCredibility; }
        public void setAuthorCredibility(double authorCredibility) { this.authorCredibility = authorCredibility; }
        public double getNovelty() { return novelty; }
        public void setNovelty(double novelty) { this.novelty = novelty; }
        public double getReproducibility() { return reproducibility; }
        public void setReproducibility(double reproducibility) { this.reproducibility = reproducibility; }
        public double getCommunityEngagement() { return communityEngagement; }
        public void setCommunityEngagement(double communityEngagement) { this.communityEngagement = communityEngagement; }
        public double getRecency() { return recency; }
        public void setRecency(double recency) { this.recency = recency; }
    }

    public static class Scoring {
        private Duration recencyHalfLife = Duration.ofDays(23);
        private double neutralAuthorCredibility = 0.5;
        private double codePresenceCredit = 0.2;

        public Duration getRecencyHalfLife() { return recencyHalfLife; }
        public void setRecencyHalfLife(Duration recencyHalfLife) { this.recencyHalfLife = recencyHalfLife; }
        public double getNeutralAuthorCredibility() { return neutralAuthorCredibility; }
        public void setNeutralAuthorCredibility(double neutralAuthorCredibility) { this.neutralAuthorCredibility = neutralAuthorCredibility; }
        public double getCodePresenceCredit() { return codePresenceCredit; }
        public void setCodePresenceCredit(double codePresenceCredit) { this.codePresenceCredit = codePresenceCredit; }
    }

    public static class Freshness {
        private Duration ageThreshold = Duration.ofDays(30);
        private double maxMultiplier = 1.5;
        private long tractionFloor = 1;

        public Duration getAgeThreshold() { return ageThreshold; }
        public void setAgeThreshold(Duration ageThreshold) { this.ageThreshold = ageThreshold; }
        public double getMaxMultiplier() { return maxMultiplier; }
        public void setMaxMultiplier(double maxMultiplier) { this.maxMultiplier = maxMultiplier; }
        public long getTractionFloor() { return tractionFloor; }
        public void setTractionFloor(long tractionFloor) { this.tractionFloor = tractionFloor; }
    }

    public static class Novelty {
        private double semanticWeight = 0.6;
        private double keywordWeight = 0.4;
        private double fallbackDiscount = 0.8;
        private int neighbours = 10;

        public double getSemanticWeight() { return semanticWeight; }
        public void setSemanticWeight(double semanticWeight) { this.semanticWeight = semanticWeight; }
        public double getKeywordWeight() { return keywordWeight; }
        public void setKeywordWeight(double keywordWeight) { this.keywordWeight = keywordWeight; }
        public double getFallbackDiscount() { return fallbackDiscount; }
        public void setFallbackDiscount(double fallbackDiscount) { this.fallbackDiscount = fallbackDiscount; }
        public int getNeighbours() { return neighbours; }
        public void setNeighbours(int neighbours) { this.neighbours = neighbours; }
    }

    public static class RateLimit {
        private Duration maxWait = Duration.ofSeconds(30);
        private int highPriorityOverrideBudget = 2;
        private double lowPriorityReserveRatio = 0.2;
        private double jitterRatio = 0.2;
        private final Provider defaults = new Provider();
        private Map<String, Provider> providers = new LinkedHashMap<>();

        public Duration getMaxWait() { return maxWait; }
        public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
        public int getHighPriorityOverrideBudget() { return highPriorityOverrideBudget; }
        public void setHighPriorityOverrideBudget(int highPriorityOverrideBudget) { this.highPriorityOverrideBudget = highPriorityOverrideBudget; }
        public double getLowPriorityReserveRatio() { return lowPriorityReserveRatio; }
        public void setLowPriorityReserveRatio(double lowPriorityReserveRatio) { this.lowPriorityReserveRatio = lowPriorityReserveRatio; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
        public Provider getDefaults() { return defaults; }
        public Map<String, Provider> getProviders() { return providers; }
        public void setProviders(Map<String, Provider> providers) { this.providers = providers; }
    }

    public static class Provider {
        private int requestsPerWindow = 60;
        private Duration window = Duration.ofMinutes(1);
        private Duration backoffFloor = Duration.ofSeconds(1);
        private Duration backoffCap = Duration.ofSeconds(300);
        private int maxRetries = 3;

        ProviderLimitConfig toConfig() {
            return new ProviderLimitConfig(requestsPerWindow, window, backoffFloor, backoffCap, maxRetries);
        }

        public int getRequestsPerWindow() { return requestsPerWindow; }
        public void setRequestsPerWindow(int requestsPerWindow) { this.requestsPerWindow = requestsPerWindow; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public Duration getBackoffFloor() { return backoffFloor; }
        public void setBackoffFloor(Duration backoffFloor) { this.backoffFloor = backoffFloor; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Cache {
        private Map<VolatilityClass, Duration> ttl = new EnumMap<>(TtlTable.defaults().ttls());
        private int maxEntries = 10_000;
        private Duration purgeGrace = Duration.ofHours(1);
        private Duration singleFlightTimeout = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofMinutes(5);

        public Map<VolatilityClass, Duration> getTtl() { return ttl; }
        public void setTtl(Map<VolatilityClass, Duration> ttl) { this.ttl = ttl; }
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
        public Duration getPurgeGrace() { return purgeGrace; }
        public void setPurgeGrace(Duration purgeGrace) { this.purgeGrace = purgeGrace; }
        public Duration getSingleFlightTimeout() { return singleFlightTimeout; }
        public void setSingleFlightTimeout(Duration singleFlightTimeout) { this.singleFlightTimeout = singleFlightTimeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Baseline {
        private int windowDays = BaselinePolicy.DEFAULT_WINDOW_DAYS;
        private int minSampleSize = BaselinePolicy.DEFAULT_MIN_SAMPLE_SIZE;

        public int getWindowDays() { return windowDays; }
        public void setWindowDays(int windowDays) { this.windowDays = windowDays; }
        public int getMinSampleSize() { return minSampleSize; }
        public void setMinSampleSize(int minSampleSize) { this.minSampleSize = minSampleSize; }
    }

    public static class Cycle {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration interval = Duration.ofMinutes(15);
        private Duration deadline = Duration.ofMinutes(10);
        private int parallelism = 4;
        private double degradedFailureRatio = 0.2;
        private int topN = 100;
        private int trendingN = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getDeadline() { return deadline; }
        public void setDeadline(Duration deadline) { this.deadline = deadline; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public double getDegradedFailureRatio() { return degradedFailureRatio; }
        public void setDegradedFailureRatio(double degradedFailureRatio) { this.degradedFailureRatio = degradedFailureRatio; }
        public int getTopN() { return topN; }
        public void setTopN(int topN) { this.topN = topN; }
        public int getTrendingN() { return trendingN; }
        public void setTrendingN(int trendingN) { this.trendingN = trendingN; }
    }

    public static class Similarity {
        /** {@code none}, {@code memory} or {@code hnsw}. */
        private String engine = "memory";
        private int dimension = 384;
        private int maxItems = 100_000;

        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }
        public int getDimension() { return dimension; }
        public void setDimension(int dimension) { this.dimension = dimension; }
        public int getMaxItems() { return maxItems; }
        public void setMaxItems(int maxItems) { this.maxItems = maxItems; }
    }

    public static class Services {
        private String catalogBaseUrl = "http://localhost:8081";
        private String scoresBaseUrl = "http://localhost:8082";
        private String embeddingsBaseUrl = "http://localhost:8083";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(15);

        public String getCatalogBaseUrl() { return catalogBaseUrl; }
        public void setCatalogBaseUrl(String catalogBaseUrl) { this.catalogBaseUrl = catalogBaseUrl; }
        public String getScoresBaseUrl() { return scoresBaseUrl; }
        public void setScoresBaseUrl(String scoresBaseUrl) { this.scoresBaseUrl = scoresBaseUrl; }
        public String getEmbeddingsBaseUrl() { return embeddingsBaseUrl; }
        public void setEmbeddingsBaseUrl(String embeddingsBaseUrl) { this.embeddingsBaseUrl = embeddingsBaseUrl; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getResponseTimeout() { return responseTimeout; }
        public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }
    }
}

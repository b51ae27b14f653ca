package com.paperradar.ranking.config;

import com.paperradar.common.cache.CachePolicy;
import com.paperradar.common.model.VolatilityClass;
import com.paperradar.common.ratelimit.RateLimitPolicy;
import com.paperradar.common.scoring.ScoringPolicy;
import com.paperradar.ranking.engine.CyclePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankingPropertiesTest {

    private static RankingProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
            .bindOrCreate("ranking", RankingProperties.class);
    }

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        @DisplayName("convert into valid policies")
        void valid() {
            RankingProperties properties = new RankingProperties();

            ScoringPolicy scoring = properties.toScoringPolicy();
            CyclePolicy cycle = properties.toCyclePolicy();
            CachePolicy cache = properties.toCachePolicy();

            assertEquals(0.25, scoring.weights().citationMomentum(), 1e-12);
            assertEquals(Duration.ofDays(23), scoring.recencyHalfLife());
            assertEquals(Duration.ofMinutes(10), cycle.deadline());
            assertEquals(Duration.ofMinutes(10), cache.ttlTable().ttlFor(VolatilityClass.TRENDING));
            assertEquals(Duration.ofDays(30), cache.ttlTable().ttlFor(VolatilityClass.EMBEDDINGS));
            assertEquals(30, properties.toBaselinePolicy().minSampleSize());
        }
    }

    @Nested
    @DisplayName("binding")
    class Binding {

        @Test
        @DisplayName("reads durations, per-provider limits and the TTL table")
        void binds() {
            RankingProperties properties = bind(Map.of(
                "ranking.cycle.interval", "20m",
                "ranking.cycle.deadline", "12m",
                "ranking.rate-limit.providers.catalog.requests-per-window", "10",
                "ranking.rate-limit.providers.catalog.window", "1s",
                "ranking.cache.ttl.trending", "5m",
                "ranking.cache.ttl.derived-metrics", "1h",
                "ranking.cache.ttl.metadata", "1d",
                "ranking.cache.ttl.embeddings", "7d"));

            RateLimitPolicy limits = properties.toRateLimitPolicy();

            assertEquals(Duration.ofMinutes(12), properties.toCyclePolicy().deadline());
            assertEquals(10, limits.forProvider("catalog").requestsPerWindow());
            assertEquals(10.0, limits.forProvider("catalog").refillPerSecond(), 1e-9);
            assertEquals(60, limits.forProvider("unknown").requestsPerWindow());
            assertEquals(Duration.ofMinutes(5), properties.toCachePolicy().ttlTable().ttlFor(VolatilityClass.TRENDING));
        }

        @Test
        @DisplayName("weights that do not sum to one are rejected")
        void badWeights() {
            RankingProperties properties = bind(Map.of("ranking.weights.novelty", "0.5"));

            assertThrows(IllegalArgumentException.class, properties::toScoringPolicy);
        }

        @Test
        @DisplayName("a deadline longer than the interval is rejected")
        void deadlineBeyondInterval() {
            RankingProperties properties = bind(Map.of(
                "ranking.cycle.interval", "5m",
                "ranking.cycle.deadline", "6m"));

            assertThrows(IllegalArgumentException.class, properties::toCyclePolicy);
        }

        @Test
        @DisplayName("a TTL table that shortens with lower volatility is rejected")
        void nonMonotonicTtl() {
            RankingProperties properties = bind(Map.of(
                "ranking.cache.ttl.trending", "1d",
                "ranking.cache.ttl.derived-metrics", "1h",
                "ranking.cache.ttl.metadata", "7d",
                "ranking.cache.ttl.embeddings", "30d"));

            assertThrows(IllegalArgumentException.class, properties::toCachePolicy);
        }
    }
}

package com.paperradar.ranking.controller;

import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.common.ratelimit.RateLimitPolicy;
import com.paperradar.common.ratelimit.RateLimiter;
import com.paperradar.ranking.engine.RankingCaches;
import com.paperradar.ranking.engine.RankingEngine;
import com.paperradar.ranking.job.RankingCycleSupervisor;
import com.paperradar.ranking.read.ScoreReadService;
import com.paperradar.ranking.support.RankingFixtures.RecordingPersistence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static com.paperradar.ranking.support.RankingFixtures.CLOCK;
import static com.paperradar.ranking.support.RankingFixtures.caches;
import static com.paperradar.ranking.support.RankingFixtures.cyclePolicy;
import static com.paperradar.ranking.support.RankingFixtures.engine;
import static com.paperradar.ranking.support.RankingFixtures.population;

class RankingControllersTest {

    private final List<ArtifactMetrics> pop = population("cs.LG", 30, 80, 8L);
    private final RankingCaches caches = caches();
    private final RateLimiter rateLimiter = new RateLimiter(RateLimitPolicy.standard(), CLOCK);

    private RankingEngine engine;
    private RankingCycleSupervisor supervisor;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = engine(cyclePolicy(Duration.ofMinutes(1), 1), caches,
            new RecordingPersistence(Duration.ofMillis(50), false));
        supervisor = new RankingCycleSupervisor(engine, deadline -> Mono.just(pop), CLOCK);
        client = WebTestClient.bindToController(
                new RankingOpsController(supervisor, rateLimiter, caches),
                new RankingReadController(new ScoreReadService(caches, engine)))
            .build();
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    @Test
    @DisplayName("POST /cycles starts a cycle and refuses a second one with 409")
    void triggerAndConflict() {
        client.post().uri("/api/v1/ranking/cycles").exchange()
            .expectStatus().isAccepted()
            .expectBody().jsonPath("$.cycleId").isNotEmpty();

        client.post().uri("/api/v1/ranking/cycles").exchange()
            .expectStatus().isEqualTo(409)
            .expectBody().jsonPath("$.error").isNotEmpty();

        client.delete().uri("/api/v1/ranking/cycles/current").exchange()
            .expectStatus().isOk();
    }

    @Test
    @DisplayName("reads answer 404 before any cycle and data after one")
    void readsAfterCycle() {
        client.get().uri("/api/v1/ranking/cycles/last").exchange().expectStatus().isNotFound();
        client.get().uri("/api/v1/ranking/top").exchange().expectStatus().isNotFound();
        client.get().uri("/api/v1/ranking/scores/cs.LG-0").exchange().expectStatus().isNotFound();

        supervisor.runOnce().block(Duration.ofSeconds(30));

        client.get().uri("/api/v1/ranking/cycles/last").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status").isEqualTo("COMPLETED");
        client.get().uri("/api/v1/ranking/top?limit=5").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.stale").isEqualTo(false)
            .jsonPath("$.value.entries.length()").isEqualTo(5);
        client.get().uri("/api/v1/ranking/scores/cs.LG-0").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.value.artifactId").isEqualTo("cs.LG-0");
    }

    @Test
    @DisplayName("limiter inspection and reset, cache stats")
    void operatorViews() {
        rateLimiter.recordFailure("catalog", true);

        client.get().uri("/api/v1/ranking/limiters/catalog").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.consecutiveFailures").isEqualTo(1);

        client.post().uri("/api/v1/ranking/limiters/catalog/reset").exchange().expectStatus().isOk();

        client.get().uri("/api/v1/ranking/limiters/catalog").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.consecutiveFailures").isEqualTo(0);

        client.get().uri("/api/v1/ranking/cache/stats").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.length()").isEqualTo(3);
    }

    @Test
    @DisplayName("DELETE /cycles/current without a running cycle is 404")
    void cancelNothing() {
        client.delete().uri("/api/v1/ranking/cycles/current").exchange().expectStatus().isNotFound();
    }
}

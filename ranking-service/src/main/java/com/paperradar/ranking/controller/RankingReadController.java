package com.paperradar.ranking.controller;

import com.paperradar.common.exception.MalformedArtifactException;
import com.paperradar.common.model.ArtifactMetrics;
import com.paperradar.ranking.read.ScoreReadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/** Scores and leaderboards as cached by the last cycles. 404 until a cycle has produced them. */
@RestController
@RequestMapping("/api/v1/ranking")
public class RankingReadController {

    private static final Logger log = LoggerFactory.getLogger(RankingReadController.class);

    private final ScoreReadService reads;

    public RankingReadController(ScoreReadService reads) {
        this.reads = reads;
    }

    @GetMapping("/scores/{artifactId}")
    public Mono<ResponseEntity<Object>> score(@PathVariable String artifactId) {
        return reads.scoreFor(artifactId)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .defaultIfEmpty(notFound("no score cached for " + artifactId));
    }

    /** Scores an artifact the last cycle did not cover, against that cycle's baselines. */
    @PostMapping("/scores")
    public Mono<ResponseEntity<Object>> scoreOnDemand(@RequestBody ArtifactMetrics artifact) {
        log.info("[RankingAPI] on-demand score. artifactId={}", artifact.id());
        return reads.scoreOrCompute(artifact)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(e -> {
                int status = isMalformed(e) ? 400 : 503;
                log.warn("[RankingAPI] on-demand score failed. artifactId={} status={} error={}",
                    artifact.id(), status, e.getMessage());
                return Mono.just(ResponseEntity.status(status).<Object>body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }

    @GetMapping("/top")
    public Mono<ResponseEntity<Object>> top(@RequestParam(defaultValue = "0") int limit) {
        return reads.topRanking(limit)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .defaultIfEmpty(notFound("no ranking computed yet"));
    }

    @GetMapping("/trending")
    public Mono<ResponseEntity<Object>> trending(@RequestParam(defaultValue = "0") int limit) {
        return reads.trending(limit)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .defaultIfEmpty(notFound("no trending list computed yet"));
    }

    // the cache wraps compute failures in CacheComputeException
    private static boolean isMalformed(Throwable e) {
        return e instanceof MalformedArtifactException || e.getCause() instanceof MalformedArtifactException;
    }

    private static ResponseEntity<Object> notFound(String message) {
        return ResponseEntity.status(404).body(Map.of("error", message));
    }
}

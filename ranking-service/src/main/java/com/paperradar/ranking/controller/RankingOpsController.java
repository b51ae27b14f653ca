package com.paperradar.ranking.controller;

import com.paperradar.common.exception.CycleAlreadyRunningException;
import com.paperradar.common.ratelimit.RateLimiter;
import com.paperradar.ranking.engine.RankingCaches;
import com.paperradar.ranking.job.RankingCycleSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator surface for the ranking service.
 *
 * <p>Typical flow:
 * <ol>
 *   <li>POST /cycles, start a cycle outside the schedule (409 while one runs)</li>
 *   <li>GET  /cycles/last, poll for its report</li>
 *   <li>GET  /limiters, inspect provider backoff when a cycle degrades</li>
 *   <li>POST /limiters/{provider}/reset, clear a stuck backoff</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/ranking")
public class RankingOpsController {

    private static final Logger log = LoggerFactory.getLogger(RankingOpsController.class);

    private final RankingCycleSupervisor supervisor;
    private final RateLimiter rateLimiter;
    private final RankingCaches caches;

    public RankingOpsController(RankingCycleSupervisor supervisor, RateLimiter rateLimiter, RankingCaches caches) {
        this.supervisor = supervisor;
        this.rateLimiter = rateLimiter;
        this.caches = caches;
    }

    @PostMapping("/cycles")
    public ResponseEntity<Map<String, Object>> trigger() {
        try {
            String cycleId = supervisor.trigger();
            log.info("[RankingAPI] cycle triggered. cycleId={}", cycleId);
            return ResponseEntity.accepted().body(Map.of("cycleId", cycleId));
        } catch (CycleAlreadyRunningException e) {
            log.info("[RankingAPI] trigger refused. reason={}", e.getMessage());
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/cycles/last")
    public ResponseEntity<Object> lastCycle() {
        return supervisor.lastReport()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(404).<Object>body(Map.of("error", "no cycle has finished yet")));
    }

    @DeleteMapping("/cycles/current")
    public ResponseEntity<Map<String, Object>> cancelCurrent() {
        String cycleId = supervisor.currentCycleId().orElse("");
        boolean cancelled = supervisor.cancel();
        log.info("[RankingAPI] cancel. cycleId={} cancelled={}", cycleId, cancelled);
        if (!cancelled) {
            return ResponseEntity.status(404).body(Map.of("error", "no cycle is running"));
        }
        return ResponseEntity.ok(Map.of("cancelled", cycleId));
    }

    @GetMapping("/limiters")
    public ResponseEntity<Object> limiters() {
        return ResponseEntity.ok(rateLimiter.snapshots());
    }

    @GetMapping("/limiters/{provider}")
    public ResponseEntity<Object> limiter(@PathVariable String provider) {
        return ResponseEntity.ok(rateLimiter.snapshot(provider));
    }

    @PostMapping("/limiters/{provider}/reset")
    public ResponseEntity<Map<String, Object>> resetLimiter(@PathVariable String provider) {
        log.info("[RankingAPI] limiter reset. provider={}", provider);
        rateLimiter.reset(provider);
        return ResponseEntity.ok(Map.of("reset", provider));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Object> cacheStats() {
        return ResponseEntity.ok(caches.stats());
    }
}

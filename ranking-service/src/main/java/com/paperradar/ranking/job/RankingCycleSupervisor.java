package com.paperradar.ranking.job;

import com.paperradar.common.collaborator.PopulationSource;
import com.paperradar.common.exception.CycleAlreadyRunningException;
import com.paperradar.common.trace.TraceContextUtil;
import com.paperradar.ranking.engine.CyclePolicy;
import com.paperradar.ranking.engine.CycleReport;
import com.paperradar.ranking.engine.RankingEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the ranking cycle lifecycle: the periodic loop, operator triggers and cancellation.
 *
 * <p>The loop follows a fixed rate:
 * <pre>
 *   delay(initialDelay) → run cycle → delay(interval − elapsed) → run cycle → ...
 * </pre>
 * Each iteration is a fresh {@link Mono}; its terminal {@code subscribe()} schedules the
 * next one, so a failed cycle never stops the loop.
 *
 * <p>At most one cycle runs at a time. A trigger while a cycle is in flight fails with
 * {@link CycleAlreadyRunningException}; a scheduled tick in that situation is skipped.
 */
@Component
public class RankingCycleSupervisor {

    private static final Logger log = LoggerFactory.getLogger(RankingCycleSupervisor.class);

    private final RankingEngine engine;
    private final PopulationSource populationSource;
    private final CyclePolicy policy;
    private final Clock clock;

    private final AtomicReference<RunningCycle> running = new AtomicReference<>();
    private volatile CycleReport lastReport;
    private volatile Disposable loop;
    private volatile boolean stopped;

    public RankingCycleSupervisor(RankingEngine engine, PopulationSource populationSource, Clock clock) {
        this.engine = engine;
        this.populationSource = populationSource;
        this.policy = engine.cyclePolicy();
        this.clock = clock;
    }

    @PostConstruct
    public void startLoop() {
        if (!policy.enabled()) {
            log.info("RANKING_LOOP_DISABLED");
            return;
        }
        log.info("RANKING_LOOP_STARTED initialDelaySeconds={} intervalSeconds={} deadlineSeconds={} parallelism={}",
            policy.initialDelay().toSeconds(), policy.interval().toSeconds(),
            policy.deadline().toSeconds(), policy.parallelism());
        scheduleNext(policy.initialDelay());
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = loop;
        if (current != null) current.dispose();
        cancel();
        log.info("RANKING_LOOP_STOPPED");
    }

    // ── operator surface ────────────────────────────────────────────────────

    /**
     * Starts a cycle now and returns its id without waiting for it.
     *
     * @throws CycleAlreadyRunningException when a cycle is already in flight
     */
    public String trigger() {
        RunningCycle cycle = begin();
        log.info("RANKING_CYCLE_TRIGGERED cycleId={}", cycle.cycleId());
        return cycle.cycleId();
    }

    /** Starts a cycle when subscribed and emits its report. */
    public Mono<CycleReport> runOnce() {
        return Mono.defer(() -> Mono.fromFuture(begin().result()));
    }

    /** @return false when no cycle was running */
    public boolean cancel() {
        RunningCycle cycle = running.get();
        if (cycle == null) return false;
        log.warn("RANKING_CYCLE_CANCEL_REQUESTED cycleId={}", cycle.cycleId());
        cycle.handle().dispose();
        return true;
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public Optional<String> currentCycleId() {
        return Optional.ofNullable(running.get()).map(RunningCycle::cycleId);
    }

    /** Completes with the in-flight cycle's report, or immediately with empty if none runs. */
    public Mono<CycleReport> awaitCurrent() {
        RunningCycle cycle = running.get();
        return cycle == null ? Mono.empty() : Mono.fromFuture(cycle.result());
    }

    // ── loop ────────────────────────────────────────────────────────────────

    private void scheduleNext(Duration delay) {
        if (stopped) return;
        loop = Mono.delay(delay)
            .then(Mono.defer(() -> {
                Instant tickStart = clock.instant();
                return runOnce()
                    .map(report -> nextDelay(tickStart))
                    .onErrorResume(CycleAlreadyRunningException.class, e -> {
                        log.info("RANKING_TICK_SKIPPED reason={}", e.getMessage());
                        return Mono.just(nextDelay(tickStart));
                    });
            }))
            .subscribe(
                this::scheduleNext,
                err -> {
                    log.error("RANKING_CYCLE_FAILED error={} nextInSeconds={}",
                        err.getMessage(), policy.interval().toSeconds(), err);
                    scheduleNext(policy.interval());
                });
    }

    private Duration nextDelay(Instant tickStart) {
        Duration elapsed = Duration.between(tickStart, clock.instant());
        Duration remaining = policy.interval().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private RunningCycle begin() {
        String cycleId = TraceContextUtil.newCycleId();
        RunningCycle cycle = new RunningCycle(cycleId, clock.instant(), new CompletableFuture<>(), Disposables.swap());
        if (!running.compareAndSet(null, cycle)) {
            RunningCycle other = running.get();
            throw new CycleAlreadyRunningException(other == null ? "unknown" : other.cycleId());
        }
        Disposable subscription = engine.runCycle(cycleId, populationSource)
            .doOnCancel(() -> finish(cycle, null, new CancellationException("cycle " + cycleId + " cancelled")))
            .subscribe(
                report -> finish(cycle, report, null),
                err -> finish(cycle, null, err));
        cycle.handle().update(subscription);
        return cycle;
    }

    private void finish(RunningCycle cycle, CycleReport report, Throwable error) {
        running.compareAndSet(cycle, null);
        if (report != null) {
            lastReport = report;
            cycle.result().complete(report);
            return;
        }
        if (!(error instanceof CancellationException)) {
            log.error("RANKING_CYCLE_ERROR cycleId={} error={}", cycle.cycleId(), error.getMessage());
        } else {
            log.warn("RANKING_CYCLE_CANCELLED cycleId={}", cycle.cycleId());
        }
        cycle.result().completeExceptionally(error);
    }

    private record RunningCycle(String cycleId, Instant startedAt, CompletableFuture<CycleReport> result,
                                Disposable.Swap handle) {}
}

package com.paperradar.common.cache;

import com.paperradar.common.exception.CacheComputeException;
import com.paperradar.common.model.VolatilityClass;
import com.paperradar.common.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.paperradar.common.model.VolatilityClass.DERIVED_METRICS;
import static com.paperradar.common.model.VolatilityClass.TRENDING;
import static org.junit.jupiter.api.Assertions.*;

class VolatilityCacheTest {

    private MutableClock clock;
    private VolatilityCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        cache = new VolatilityCache<>("test", new CachePolicy(TtlTable.defaults(), 100,
            Duration.ofMinutes(30), Duration.ofSeconds(5)), clock);
    }

    // ── TTL by volatility class ───────────────────────────────────────────

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("a TRENDING entry reads as a miss once its TTL has elapsed")
        void trendingExpires() {
            cache.put("trending:cs.LG", "list", TRENDING);
            assertEquals("list", cache.get("trending:cs.LG").orElseThrow());

            clock.advance(cache.ttlFor(TRENDING).plusSeconds(1));
            assertTrue(cache.get("trending:cs.LG").isEmpty());
        }

        @Test
        @DisplayName("expiry is exact: an entry read at expiresAt is already gone")
        void expiresAtBoundary() {
            cache.put("k", "v", TRENDING);
            clock.advance(Duration.ofMinutes(10));
            assertTrue(cache.get("k").isEmpty());
        }

        @Test
        @DisplayName("less volatile classes outlive more volatile ones")
        void ttlFollowsClass() {
            cache.put("trend", "a", TRENDING);
            cache.put("score", "b", DERIVED_METRICS);
            clock.advance(Duration.ofMinutes(11));
            assertTrue(cache.get("trend").isEmpty());
            assertEquals("b", cache.get("score").orElseThrow());
        }

        @Test
        @DisplayName("expired entries stay readable as stale until purged after the grace period")
        void staleUntilPurged() {
            cache.put("k", "v", TRENDING);
            clock.advance(Duration.ofMinutes(15));

            CachedValue<String> stale = cache.getAllowingStale("k").orElseThrow();
            assertTrue(stale.stale());
            assertEquals(Duration.ofMinutes(15), stale.age());
            assertEquals(0, cache.purgeExpired());

            clock.advance(Duration.ofMinutes(30));
            assertEquals(1, cache.purgeExpired());
            assertTrue(cache.getAllowingStale("k").isEmpty());
        }

        @Test
        @DisplayName("fresh entries are served as not stale")
        void freshNotStale() {
            cache.put("k", "v", DERIVED_METRICS);
            clock.advance(Duration.ofHours(1));
            CachedValue<String> fresh = cache.getAllowingStale("k").orElseThrow();
            assertFalse(fresh.stale());
            assertEquals(Duration.ofHours(1), fresh.age());
        }
    }

    // ── capacity and invalidation ─────────────────────────────────────────

    @Nested
    @DisplayName("capacity and invalidation")
    class Capacity {

        @Test
        @DisplayName("past the ceiling the least recently used entry goes first")
        void lruEviction() {
            VolatilityCache<String> small = new VolatilityCache<>("small",
                new CachePolicy(TtlTable.defaults(), 3, Duration.ZERO, Duration.ofSeconds(5)), clock);
            small.put("a", "1", DERIVED_METRICS);
            small.put("b", "2", DERIVED_METRICS);
            small.put("c", "3", DERIVED_METRICS);
            small.get("a");
            small.put("d", "4", DERIVED_METRICS);

            assertEquals(3, small.size());
            assertTrue(small.get("b").isEmpty());
            assertTrue(small.get("a").isPresent());
            assertEquals(1, small.stats().evictions());
        }

        @Test
        @DisplayName("invalidatePrefix drops only matching keys")
        void prefixInvalidation() {
            cache.put("score:1", "a", DERIVED_METRICS);
            cache.put("score:2", "b", DERIVED_METRICS);
            cache.put("ranking:top", "c", DERIVED_METRICS);

            assertEquals(2, cache.invalidatePrefix("score:"));
            assertTrue(cache.get("ranking:top").isPresent());
            assertTrue(cache.invalidate("ranking:top"));
            assertFalse(cache.invalidate("ranking:top"));
        }

        @Test
        @DisplayName("stats count hits and misses")
        void stats() {
            cache.put("k", "v", DERIVED_METRICS);
            cache.get("k");
            cache.get("k");
            cache.get("absent");
            CacheStats stats = cache.stats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-12);
        }
    }

    // ── single flight ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("getOrCompute")
    class SingleFlight {

        @Test
        @DisplayName("computes once and serves the cached value afterwards")
        void cachesComputedValue() {
            AtomicInteger calls = new AtomicInteger();
            Supplier<Mono<String>> compute = () -> Mono.fromCallable(() -> "v" + calls.incrementAndGet());

            assertEquals("v1", cache.getOrCompute("k", DERIVED_METRICS, compute).block());
            assertEquals("v1", cache.getOrCompute("k", DERIVED_METRICS, compute).block());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("N concurrent callers share exactly one computation")
        void concurrentCallersShareOneComputation() throws Exception {
            int callers = 16;
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();
            Supplier<Mono<String>> compute = () -> Mono.fromCallable(() -> {
                calls.incrementAndGet();
                release.await(5, TimeUnit.SECONDS);
                return "value";
            }).subscribeOn(Schedulers.boundedElastic());

            List<Future<String>> results = runConcurrently(callers,
                () -> cache.getOrCompute("k", DERIVED_METRICS, compute).block(Duration.ofSeconds(5)));
            awaitJoins(callers - 1);
            release.countDown();

            for (Future<String> f : results) assertEquals("value", f.get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
            assertEquals(1, cache.stats().computations());
            assertEquals("value", cache.get("k").orElseThrow());
        }

        @Test
        @DisplayName("a failure reaches every waiter and leaves the key uncached")
        void failurePropagatesToAllWaiters() throws Exception {
            int callers = 8;
            CountDownLatch release = new CountDownLatch(1);
            Supplier<Mono<String>> failing = () -> Mono.<String>fromCallable(() -> {
                release.await(5, TimeUnit.SECONDS);
                throw new IllegalStateException("provider down");
            }).subscribeOn(Schedulers.boundedElastic());

            List<Future<String>> results = runConcurrently(callers,
                () -> cache.getOrCompute("k", DERIVED_METRICS, failing).block(Duration.ofSeconds(5)));
            awaitJoins(callers - 1);
            release.countDown();

            for (Future<String> f : results) {
                ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
                assertInstanceOf(CacheComputeException.class, e.getCause());
            }
            assertTrue(cache.get("k").isEmpty());
            assertEquals("retry", cache.getOrCompute("k", DERIVED_METRICS, () -> Mono.just("retry")).block());
        }

        @Test
        @DisplayName("a computation that produces nothing is a failure")
        void emptyIsFailure() {
            assertThrows(CacheComputeException.class,
                () -> cache.getOrCompute("k", DERIVED_METRICS, Mono::<String>empty).block());
            assertTrue(cache.get("k").isEmpty());
        }

        @Test
        @DisplayName("a waiter gives up after its own limit")
        void waiterTimesOut() {
            CacheComputeException e = assertThrows(CacheComputeException.class,
                () -> cache.getOrCompute("k", DERIVED_METRICS, Mono::<String>never, Duration.ofMillis(50)).block());
            assertTrue(e.getMessage().contains("single-flight wait exceeded"));
        }

        @Test
        @DisplayName("invalidating a key while it computes keeps the result out of the cache")
        void invalidateDetachesRunningComputation() throws Exception {
            Sinks.One<String> result = Sinks.one();
            CompletableFuture<String> waiter = cache.getOrCompute("k", DERIVED_METRICS, result::asMono).toFuture();

            cache.invalidate("k");
            result.tryEmitValue("computed-before-invalidate");

            assertEquals("computed-before-invalidate", waiter.get(5, TimeUnit.SECONDS));
            assertTrue(cache.get("k").isEmpty());
            assertTrue(cache.getAllowingStale("k").isEmpty());
            assertEquals("fresh", cache.getOrCompute("k", DERIVED_METRICS, () -> Mono.just("fresh")).block());
        }

        @Test
        @DisplayName("invalidatePrefix also detaches computations under the prefix")
        void invalidatePrefixDetachesRunningComputation() {
            Sinks.One<String> result = Sinks.one();
            cache.getOrCompute("score:a", DERIVED_METRICS, result::asMono).subscribe();

            cache.invalidatePrefix("score:");
            result.tryEmitValue("old");

            assertTrue(cache.get("score:a").isEmpty());
        }
    }

    // ── configuration ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("TtlTable")
    class Table {

        @Test
        @DisplayName("every volatility class needs a TTL")
        void incomplete() {
            assertThrows(IllegalArgumentException.class,
                () -> new TtlTable(Map.of(TRENDING, Duration.ofMinutes(10))));
        }

        @Test
        @DisplayName("a less volatile class may not expire sooner")
        void ordered() {
            assertThrows(IllegalArgumentException.class, () -> new TtlTable(Map.of(
                TRENDING, Duration.ofHours(7),
                DERIVED_METRICS, Duration.ofHours(6),
                VolatilityClass.METADATA, Duration.ofDays(7),
                VolatilityClass.EMBEDDINGS, Duration.ofDays(30))));
        }
    }

    // ── helpers ───────────────────────────────────────────────────────────

    private static <T> List<Future<T>> runConcurrently(int n, java.util.concurrent.Callable<T> task) {
        ExecutorService pool = Executors.newFixedThreadPool(n);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) futures.add(pool.submit(task));
        pool.shutdown();
        return futures;
    }

    private void awaitJoins(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (cache.stats().singleFlightJoins() < expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, cache.stats().singleFlightJoins());
    }
}

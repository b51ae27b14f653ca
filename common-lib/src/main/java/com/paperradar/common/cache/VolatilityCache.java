package com.paperradar.common.cache;

import com.paperradar.common.exception.CacheComputeException;
import com.paperradar.common.model.VolatilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory cache whose TTL is chosen by the volatility class of each entry.
 *
 * <p><b>Expiry is lazy.</b> {@link #get} treats an entry past {@code expiresAt} as absent
 * but leaves it in place, so {@link #getAllowingStale} can still serve it with a stale flag.
 * {@link #purgeExpired} drops entries once they are past expiry plus the grace period.
 *
 * <p><b>Capacity.</b> Past {@code maxEntries} the least recently read or written entries are
 * evicted, whatever their TTL.
 *
 * <p><b>Single flight.</b> {@link #getOrCompute} runs at most one computation per key at a
 * time. Callers arriving while it runs join it and receive the same value, or the same
 * {@link CacheComputeException}; a failed key stays uncached. Waiters are bounded by the
 * single-flight timeout or their own tighter limit, and a waiter that gives up does not
 * cancel the computation for the others. Invalidating a key detaches its running computation:
 * waiters still receive the value, but it is not stored.
 *
 * <p>All operations are per-key map operations on {@link ConcurrentHashMap}; only eviction
 * takes a lock, and only when the ceiling is exceeded.
 */
public class VolatilityCache<V> {

    private static final Logger log = LoggerFactory.getLogger(VolatilityCache.class);

    private final String name;
    private final CachePolicy policy;
    private final Clock clock;

    private final ConcurrentHashMap<String, Node<V>> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final AtomicLong accessTick = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder joins = new LongAdder();
    private final LongAdder computations = new LongAdder();

    public VolatilityCache(String name, CachePolicy policy, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    public Duration ttlFor(VolatilityClass cls) {
        return policy.ttlTable().ttlFor(cls);
    }

    /** Fresh value for {@code key}; expired entries read as a miss. */
    public Optional<V> get(String key) {
        Node<V> node = store.get(key);
        if (node == null || node.entry.isExpired(clock.instant())) {
            misses.increment();
            log.debug("CACHE_MISS cache={} key={} expired={}", name, key, node != null);
            return Optional.empty();
        }
        node.touch(accessTick.incrementAndGet());
        hits.increment();
        return Optional.of(node.entry.value());
    }

    /**
     * Any value still held for {@code key}, fresh or expired but not yet purged, with its age.
     * Does not count towards hit/miss statistics.
     */
    public Optional<CachedValue<V>> getAllowingStale(String key) {
        Node<V> node = store.get(key);
        if (node == null) return Optional.empty();
        Instant now = clock.instant();
        CacheEntry<V> e = node.entry;
        Duration age = Duration.between(e.storedAt(), now);
        return Optional.of(new CachedValue<>(e.value(), e.volatilityClass(), e.storedAt(), e.expiresAt(),
            age.isNegative() ? Duration.ZERO : age, e.isExpired(now)));
    }

    public void put(String key, V value, VolatilityClass cls) {
        if (value == null) throw new IllegalArgumentException("null values are not cacheable: " + key);
        Instant now = clock.instant();
        CacheEntry<V> entry = new CacheEntry<>(key, value, cls, now, now.plus(ttlFor(cls)));
        store.put(key, new Node<>(entry, accessTick.incrementAndGet()));
        if (store.size() > policy.maxEntries()) evictOverflow();
    }

    public Mono<V> getOrCompute(String key, VolatilityClass cls, Supplier<Mono<V>> computeFn) {
        return getOrCompute(key, cls, computeFn, policy.singleFlightTimeout());
    }

    /**
     * Cached value, or the result of the single computation for {@code key}.
     *
     * @param maxWait how long this caller waits; capped at the single-flight timeout
     */
    public Mono<V> getOrCompute(String key, VolatilityClass cls, Supplier<Mono<V>> computeFn, Duration maxWait) {
        Duration wait = maxWait.compareTo(policy.singleFlightTimeout()) < 0 ? maxWait : policy.singleFlightTimeout();
        return Mono.defer(() -> {
            Optional<V> cached = get(key);
            if (cached.isPresent()) return Mono.just(cached.get());

            CompletableFuture<V> flight = new CompletableFuture<>();
            CompletableFuture<V> existing = inFlight.putIfAbsent(key, flight);
            if (existing != null) {
                joins.increment();
                log.debug("SINGLE_FLIGHT_JOIN cache={} key={}", name, key);
                return await(key, existing, wait);
            }

            // a leader may have stored the value between our miss and our registration
            Node<V> node = store.get(key);
            if (node != null && !node.entry.isExpired(clock.instant())) {
                inFlight.remove(key, flight);
                flight.complete(node.entry.value());
                return Mono.just(node.entry.value());
            }

            computations.increment();
            launch(key, cls, computeFn, flight);
            return await(key, flight, wait);
        });
    }

    /** Drops the value for {@code key} and detaches any computation still running for it. */
    public boolean invalidate(String key) {
        boolean detached = inFlight.remove(key) != null;
        boolean removed = store.remove(key) != null;
        if (removed || detached) {
            log.debug("CACHE_INVALIDATE cache={} key={} detachedFlight={}", name, key, detached);
        }
        return removed;
    }

    /** Removes every key starting with {@code prefix}; returns how many were removed. */
    public int invalidatePrefix(String prefix) {
        inFlight.keySet().removeIf(key -> key.startsWith(prefix));
        int removed = 0;
        for (String key : store.keySet()) {
            if (key.startsWith(prefix) && store.remove(key) != null) removed++;
        }
        log.info("CACHE_INVALIDATE_PREFIX cache={} prefix={} removed={}", name, prefix, removed);
        return removed;
    }

    /** Drops entries past expiry plus the grace period; returns how many were dropped. */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(policy.purgeGrace());
        int purged = 0;
        for (Map.Entry<String, Node<V>> e : store.entrySet()) {
            if (!cutoff.isBefore(e.getValue().entry.expiresAt()) && store.remove(e.getKey(), e.getValue())) {
                purged++;
            }
        }
        if (purged > 0) log.info("CACHE_PURGED cache={} purged={} remaining={}", name, purged, store.size());
        return purged;
    }

    public CacheStats stats() {
        return new CacheStats(name, hits.sum(), misses.sum(), evictions.sum(), joins.sum(),
            computations.sum(), store.size());
    }

    public int size() {
        return store.size();
    }

    // ── internals ───────────────────────────────────────────────────────────

    private void launch(String key, VolatilityClass cls, Supplier<Mono<V>> computeFn, CompletableFuture<V> flight) {
        Mono<V> source;
        try {
            source = computeFn.get();
        } catch (RuntimeException e) {
            source = Mono.error(e);
        }
        if (source == null) source = Mono.error(new IllegalStateException("compute function returned null"));

        source.timeout(policy.singleFlightTimeout())
            .subscribe(
                value -> {
                    storeIfAttached(key, value, cls, flight);
                    flight.complete(value);
                },
                error -> {
                    inFlight.remove(key, flight);
                    log.warn("CACHE_COMPUTE_FAILED cache={} key={} error={}", name, key, error.toString());
                    flight.completeExceptionally(error instanceof CacheComputeException
                        ? error : new CacheComputeException(key, error));
                },
                () -> {
                    if (!flight.isDone()) {
                        inFlight.remove(key, flight);
                        flight.completeExceptionally(new CacheComputeException(key, "computation completed without a value"));
                    }
                });
    }

    /** Stores the result only while {@code flight} is still the registered computation for the key. */
    private void storeIfAttached(String key, V value, VolatilityClass cls, CompletableFuture<V> flight) {
        inFlight.computeIfPresent(key, (k, current) -> {
            if (current != flight) return current;
            put(key, value, cls);
            return null;
        });
    }

    private Mono<V> await(String key, CompletableFuture<V> flight, Duration wait) {
        return Mono.fromFuture(flight.copy())
            .timeout(wait)
            .onErrorMap(TimeoutException.class,
                e -> new CacheComputeException(key, "single-flight wait exceeded " + wait.toMillis() + "ms"));
    }

    private void evictOverflow() {
        if (!evictionLock.tryLock()) return;
        try {
            int overflow = store.size() - policy.maxEntries();
            if (overflow <= 0) return;
            // ticks are copied first: readers keep touching nodes while we sort
            List<Victim<V>> victims = store.entrySet().stream()
                .map(e -> new Victim<>(e.getKey(), e.getValue(), e.getValue().lastAccess))
                .sorted(Comparator.comparingLong(Victim::tick))
                .limit(overflow)
                .toList();
            for (Victim<V> victim : victims) {
                if (store.remove(victim.key(), victim.node())) {
                    evictions.increment();
                    log.debug("CACHE_EVICT cache={} key={}", name, victim.key());
                }
            }
        } finally {
            evictionLock.unlock();
        }
    }

    private record Victim<V>(String key, Node<V> node, long tick) {}

    private static final class Node<V> {
        final CacheEntry<V> entry;
        volatile long lastAccess;

        Node(CacheEntry<V> entry, long tick) {
            this.entry = entry;
            this.lastAccess = tick;
        }

        void touch(long tick) {
            lastAccess = tick;
        }
    }
}

package com.paperradar.common.cache;

import java.time.Duration;

/**
 * @param maxEntries          LRU ceiling, independent of TTL
 * @param purgeGrace          expired entries stay readable as stale this long before the sweep drops them
 * @param singleFlightTimeout longest a computation, or a wait on one, may take
 */
public record CachePolicy(TtlTable ttlTable, int maxEntries, Duration purgeGrace, Duration singleFlightTimeout) {

    public CachePolicy {
        if (ttlTable == null) throw new IllegalArgumentException("ttlTable must not be null");
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0, was " + maxEntries);
        if (purgeGrace == null || purgeGrace.isNegative()) {
            throw new IllegalArgumentException("purgeGrace must be >= 0, was " + purgeGrace);
        }
        if (singleFlightTimeout == null || singleFlightTimeout.isNegative() || singleFlightTimeout.isZero()) {
            throw new IllegalArgumentException("singleFlightTimeout must be positive, was " + singleFlightTimeout);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(TtlTable.defaults(), 10_000, Duration.ofHours(1), Duration.ofSeconds(30));
    }
}

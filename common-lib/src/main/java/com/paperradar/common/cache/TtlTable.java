package com.paperradar.common.cache;

import com.paperradar.common.model.VolatilityClass;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * TTL per volatility class. Must cover every class, and TTLs may not shrink as the
 * class gets less volatile.
 */
public record TtlTable(Map<VolatilityClass, Duration> ttls) {

    public TtlTable {
        EnumMap<VolatilityClass, Duration> copy = new EnumMap<>(VolatilityClass.class);
        copy.putAll(ttls);
        Duration previous = Duration.ZERO;
        for (VolatilityClass cls : VolatilityClass.values()) {
            Duration ttl = copy.get(cls);
            if (ttl == null) throw new IllegalArgumentException("no TTL configured for " + cls);
            if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("TTL for " + cls + " must be positive");
            if (ttl.compareTo(previous) < 0) {
                throw new IllegalArgumentException("TTL for " + cls + " (" + ttl + ") is shorter than a more volatile class");
            }
            previous = ttl;
        }
        ttls = Collections.unmodifiableMap(copy);
    }

    public Duration ttlFor(VolatilityClass cls) {
        return ttls.get(cls);
    }

    public static TtlTable defaults() {
        return new TtlTable(Map.of(
            VolatilityClass.TRENDING,        Duration.ofMinutes(10),
            VolatilityClass.DERIVED_METRICS, Duration.ofHours(6),
            VolatilityClass.METADATA,        Duration.ofDays(7),
            VolatilityClass.EMBEDDINGS,      Duration.ofDays(30)));
    }
}

package com.paperradar.common.cache;

import com.paperradar.common.model.VolatilityClass;

import java.time.Instant;

/** Stored value with its class and lifetime. {@code expiresAt = storedAt + TTL(class)}. */
public record CacheEntry<V>(String key, V value, VolatilityClass volatilityClass, Instant storedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}

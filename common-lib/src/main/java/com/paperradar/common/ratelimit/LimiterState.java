package com.paperradar.common.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable per-provider state. Every access holds this object's monitor; the limiter never
 * touches two states under one lock.
 */
final class LimiterState {

    final String provider;
    final ProviderLimitConfig config;

    double capacity;
    double tokens;
    double refillPerSecond;
    Instant windowStart;

    int consecutiveFailures;
    long totalFailures;
    Duration currentBackoff;
    Instant backoffUntil;
    int overridesUsed;

    Instant quotaResetAt;
    Integer reportedRemaining;
    Instant lastSuccess;

    LimiterState(String provider, ProviderLimitConfig config, Instant now) {
        this.provider = provider;
        this.config = config;
        this.capacity = config.requestsPerWindow();
        this.tokens = capacity;
        this.refillPerSecond = config.refillPerSecond();
        this.windowStart = now;
        this.currentBackoff = config.backoffFloor();
    }

    Instant windowEnd() {
        return windowStart.plus(config.window());
    }

    /**
     * Opens a fresh window with the full quota once the current one has run out. Grants never
     * carry across windows, so no window hands out more than {@code capacity}.
     */
    void refill(Instant now) {
        if (!now.isBefore(windowEnd())) {
            tokens = capacity;
            windowStart = now;
        }
    }

    /** Time until the bucket holds {@code required} tokens; zero when it already does. */
    Duration timeUntil(double required, Instant now) {
        if (tokens >= required) return Duration.ZERO;
        return Duration.between(now, windowEnd());
    }

    LimiterSnapshot snapshot() {
        return new LimiterSnapshot(provider, tokens, capacity, refillPerSecond, windowEnd(),
            consecutiveFailures, totalFailures, currentBackoff, backoffUntil, quotaResetAt, overridesUsed,
            lastSuccess, reportedRemaining);
    }
}

package com.paperradar.common.ratelimit;

import java.time.Duration;

/**
 * Static limits for one provider.
 *
 * @param requestsPerWindow advertised quota; also the bucket capacity
 * @param window            quota window; the bucket refills in full when it ends
 * @param backoffFloor      first backoff window after a rate-limit failure
 * @param backoffCap        backoff never grows past this
 * @param maxRetries        retries of a rate-limited call inside the caller's deadline
 */
public record ProviderLimitConfig(
    int requestsPerWindow,
    Duration window,
    Duration backoffFloor,
    Duration backoffCap,
    int maxRetries
) {

    public ProviderLimitConfig {
        if (requestsPerWindow <= 0) {
            throw new IllegalArgumentException("requestsPerWindow must be > 0, was " + requestsPerWindow);
        }
        requirePositive("window", window);
        requirePositive("backoffFloor", backoffFloor);
        requirePositive("backoffCap", backoffCap);
        if (backoffCap.compareTo(backoffFloor) < 0) {
            throw new IllegalArgumentException("backoffCap " + backoffCap + " is below backoffFloor " + backoffFloor);
        }
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
    }

    /** Average tokens per second at the configured quota. */
    public double refillPerSecond() {
        return requestsPerWindow / (window.toMillis() / 1000.0);
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + d);
        }
    }
}

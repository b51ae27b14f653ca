package com.paperradar.common.ratelimit;

import java.time.Duration;
import java.util.Map;

/**
 * Limiter-wide settings plus the per-provider table.
 *
 * @param defaults                   limits for providers absent from {@code providers}
 * @param maxWait                    longest wait {@code acquire} hands out; longer is a rejection
 * @param highPriorityOverrideBudget HIGH grants allowed through one backoff window
 * @param lowPriorityReserveRatio    share of capacity LOW requests must leave in the bucket
 * @param jitterRatio                backoff windows vary by up to this share either way
 */
public record RateLimitPolicy(
    ProviderLimitConfig defaults,
    Map<String, ProviderLimitConfig> providers,
    Duration maxWait,
    int highPriorityOverrideBudget,
    double lowPriorityReserveRatio,
    double jitterRatio
) {

    public RateLimitPolicy {
        if (defaults == null) throw new IllegalArgumentException("defaults must not be null");
        providers = Map.copyOf(providers);
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0, was " + maxWait);
        }
        if (highPriorityOverrideBudget < 0) {
            throw new IllegalArgumentException("highPriorityOverrideBudget must be >= 0");
        }
        if (!(lowPriorityReserveRatio >= 0.0 && lowPriorityReserveRatio < 1.0)) {
            throw new IllegalArgumentException("lowPriorityReserveRatio must be in [0, 1), was " + lowPriorityReserveRatio);
        }
        if (!(jitterRatio >= 0.0 && jitterRatio < 1.0)) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1), was " + jitterRatio);
        }
    }

    public ProviderLimitConfig forProvider(String provider) {
        return providers.getOrDefault(provider, defaults);
    }

    /** Published quotas of the providers the ranking pipeline talks to. */
    public static RateLimitPolicy standard() {
        Duration minute = Duration.ofMinutes(1);
        return new RateLimitPolicy(
            new ProviderLimitConfig(60, minute, Duration.ofSeconds(1), Duration.ofSeconds(300), 3),
            Map.of(
                "semantic_scholar", new ProviderLimitConfig(100, Duration.ofMinutes(5), Duration.ofSeconds(60), Duration.ofSeconds(300), 3),
                "github",           new ProviderLimitConfig(5000, Duration.ofHours(1), Duration.ofSeconds(1), Duration.ofSeconds(300), 3),
                "arxiv",            new ProviderLimitConfig(120, minute, Duration.ofSeconds(5), Duration.ofSeconds(300), 3),
                "groq",             new ProviderLimitConfig(30, minute, Duration.ofSeconds(1), Duration.ofSeconds(120), 3),
                "huggingface",      new ProviderLimitConfig(100, minute, Duration.ofSeconds(1), Duration.ofSeconds(300), 3)),
            Duration.ofSeconds(30),
            2,
            0.2,
            0.2);
    }
}

package com.paperradar.common.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/** Read-only view of one provider's limiter state, for operators. */
public record LimiterSnapshot(
    @JsonProperty("provider")             String   provider,
    @JsonProperty("tokens")               double   tokens,
    @JsonProperty("capacity")             double   capacity,
    @JsonProperty("refillPerSecond")      double   refillPerSecond,
    @JsonProperty("windowResetAt")        Instant  windowResetAt,
    @JsonProperty("consecutiveFailures")  int      consecutiveFailures,
    @JsonProperty("totalFailures")        long     totalFailures,
    @JsonProperty("currentBackoff")       Duration currentBackoff,
    @JsonProperty("backoffUntil")         Instant  backoffUntil,
    @JsonProperty("quotaResetAt")         Instant  quotaResetAt,
    @JsonProperty("overridesUsed")        int      overridesUsed,
    @JsonProperty("lastSuccess")          Instant  lastSuccess,
    @JsonProperty("reportedRemaining")    Integer  reportedRemaining
) {}

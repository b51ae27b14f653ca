package com.paperradar.common.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.paperradar.common.model.VolatilityClass;

import java.time.Duration;
import java.time.Instant;

/** A value served by the read path, annotated with how old it is and whether it expired. */
public record CachedValue<V>(
    @JsonProperty("value")            V               value,
    @JsonProperty("volatilityClass")  VolatilityClass volatilityClass,
    @JsonProperty("storedAt")         Instant         storedAt,
    @JsonProperty("expiresAt")        Instant         expiresAt,
    @JsonProperty("age")              Duration        age,
    @JsonProperty("stale")            boolean         stale
) {}

package com.paperradar.common.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
    @JsonProperty("name")               String name,
    @JsonProperty("hits")               long   hits,
    @JsonProperty("misses")             long   misses,
    @JsonProperty("evictions")          long   evictions,
    @JsonProperty("singleFlightJoins")  long   singleFlightJoins,
    @JsonProperty("computations")       long   computations,
    @JsonProperty("size")               int    size
) {

    @JsonProperty("hitRate")
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}

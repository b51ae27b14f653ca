package com.paperradar.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RankedEntry(
    @JsonProperty("rank")         int     rank,
    @JsonProperty("artifactId")   String  artifactId,
    @JsonProperty("category")     String  category,
    @JsonProperty("publishedAt")  Instant publishedAt,
    @JsonProperty("total")        double  total
) {}

package com.paperradar.ranking.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(
    @JsonProperty("id") String id,
    @JsonProperty("vector") float[] vector,
    @JsonProperty("model") String model
) {}

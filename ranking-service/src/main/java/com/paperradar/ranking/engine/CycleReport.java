package com.paperradar.ranking.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Outcome of one ranking cycle. */
public record CycleReport(
    @JsonProperty("cycleId")                 String       cycleId,
    @JsonProperty("status")                  CycleStatus  status,
    @JsonProperty("populationSize")          int          populationSize,
    @JsonProperty("scored")                  int          scored,
    @JsonProperty("failed")                  int          failed,
    @JsonProperty("persistFailures")         int          persistFailures,
    @JsonProperty("insufficientCategories")  List<String> insufficientCategories,
    @JsonProperty("startedAt")               Instant      startedAt,
    @JsonProperty("finishedAt")              Instant      finishedAt
) {

    public CycleReport {
        insufficientCategories = List.copyOf(insufficientCategories);
    }

    @JsonProperty("durationMs")
    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}

package com.paperradar.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Ordered leaderboard produced by one completed cycle. */
public record RankedList(
    @JsonProperty("cycleId")     String            cycleId,
    @JsonProperty("computedAt")  Instant           computedAt,
    @JsonProperty("entries")     List<RankedEntry> entries
) {

    public RankedList {
        entries = List.copyOf(entries);
    }
}

package com.paperradar.common.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reference distribution for one category.
 *
 * <p>{@code sampleSize} is always the category's own in-window count. When it falls below
 * the configured minimum the record is {@code insufficient}, {@code source} is
 * {@link BaselineSource#GLOBAL} and {@code stats} are the global ones.
 */
public record FieldBaseline(
    @JsonProperty("category")      String                       category,
    @JsonProperty("stats")         Map<RawMetric, Percentiles>  stats,
    @JsonProperty("sampleSize")    int                          sampleSize,
    @JsonProperty("computedAt")    Instant                      computedAt,
    @JsonProperty("source")        BaselineSource               source,
    @JsonProperty("insufficient")  boolean                      insufficient
) {

    public FieldBaseline {
        EnumMap<RawMetric, Percentiles> copy = new EnumMap<>(RawMetric.class);
        copy.putAll(stats);
        stats = Collections.unmodifiableMap(copy);
    }

    /** Statistics for {@code metric}, {@link Percentiles#EMPTY} when none were observed. */
    public Percentiles stats(RawMetric metric) {
        return stats.getOrDefault(metric, Percentiles.EMPTY);
    }

    /** This (global) baseline relabelled as the insufficient stand-in for {@code other}. */
    public FieldBaseline substituteFor(String other, int otherSampleSize) {
        return new FieldBaseline(other, stats, otherSampleSize, computedAt, BaselineSource.GLOBAL, true);
    }
}

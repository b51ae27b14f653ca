package com.paperradar.common.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/** Median, p90 and p99 of one metric over a sample, in the metric's transformed space. */
public record Percentiles(
    @JsonProperty("median")   double median,
    @JsonProperty("p90")      double p90,
    @JsonProperty("p99")      double p99,
    @JsonProperty("samples")  int    samples
) {

    public static final Percentiles EMPTY = new Percentiles(0.0, 0.0, 0.0, 0);

    /**
     * Order statistics over {@code values}. Percentiles use linear interpolation between
     * closest ranks, so {@code [1, 2, 3, 4]} has median 2.5.
     */
    public static Percentiles of(double[] values) {
        if (values.length == 0) return EMPTY;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return new Percentiles(
            interpolate(sorted, 0.50),
            interpolate(sorted, 0.90),
            interpolate(sorted, 0.99),
            sorted.length);
    }

    static double interpolate(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) return sorted[lower];
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public boolean isEmpty() {
        return samples == 0;
    }
}

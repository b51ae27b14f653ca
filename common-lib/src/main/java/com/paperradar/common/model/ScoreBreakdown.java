package com.paperradar.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Scored result for one artifact.
 *
 * <ul>
 *   <li>Seven components, each in [0, 1].</li>
 *   <li>{@code freshnessBoost} is 1.0 unless the artifact is young and has traction.</li>
 *   <li>{@code total} is the weighted sum times the boost, clamped to [0, 1].</li>
 *   <li>{@code fieldPercentile} is the artifact's citation/velocity rank inside its field.</li>
 *   <li>{@code lowConfidence} is set when the baseline was insufficient or novelty fell back
 *       to keywords.</li>
 * </ul>
 * Ranges are enforced on construction.
 */
public record ScoreBreakdown(
    @JsonProperty("artifactId")             String  artifactId,
    @JsonProperty("citationMomentum")       double  citationMomentum,
    @JsonProperty("implementationQuality")  double  implementationQuality,
    @JsonProperty("authorCredibility")      double  authorCredibility,
    @JsonProperty("novelty")                double  novelty,
    @JsonProperty("reproducibility")        double  reproducibility,
    @JsonProperty("communityEngagement")    double  communityEngagement,
    @JsonProperty("recency")                double  recency,
    @JsonProperty("freshnessBoost")         double  freshnessBoost,
    @JsonProperty("total")                  double  total,
    @JsonProperty("fieldPercentile")        double  fieldPercentile,
    @JsonProperty("lowConfidence")          boolean lowConfidence,
    @JsonProperty("computedAt")             Instant computedAt
) {

    public ScoreBreakdown {
        requireUnit("citationMomentum", citationMomentum);
        requireUnit("implementationQuality", implementationQuality);
        requireUnit("authorCredibility", authorCredibility);
        requireUnit("novelty", novelty);
        requireUnit("reproducibility", reproducibility);
        requireUnit("communityEngagement", communityEngagement);
        requireUnit("recency", recency);
        requireUnit("total", total);
        requireUnit("fieldPercentile", fieldPercentile);
        if (!(freshnessBoost >= 1.0) || Double.isInfinite(freshnessBoost)) {
            throw new IllegalArgumentException("freshnessBoost must be >= 1.0, was " + freshnessBoost);
        }
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], was " + value);
        }
    }
}

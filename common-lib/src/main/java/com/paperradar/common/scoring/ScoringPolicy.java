package com.paperradar.common.scoring;

import java.time.Duration;

/**
 * Everything tunable about scoring, validated once at startup.
 *
 * @param recencyHalfLife          age at which the recency component reads 0.5
 * @param neutralAuthorCredibility author credibility when no author signal is known
 * @param codePresenceCredit       implementation quality of a repository with no stars
 */
public record ScoringPolicy(
    ScoreWeights weights,
    FreshnessPolicy freshness,
    NoveltyPolicy novelty,
    Duration recencyHalfLife,
    double neutralAuthorCredibility,
    double codePresenceCredit
) {

    public ScoringPolicy {
        if (weights == null || freshness == null || novelty == null) {
            throw new IllegalArgumentException("weights, freshness and novelty are required");
        }
        if (recencyHalfLife == null || recencyHalfLife.isNegative() || recencyHalfLife.isZero()) {
            throw new IllegalArgumentException("recencyHalfLife must be positive, was " + recencyHalfLife);
        }
        if (!(neutralAuthorCredibility >= 0.0 && neutralAuthorCredibility <= 1.0)) {
            throw new IllegalArgumentException("neutralAuthorCredibility must be in [0, 1]");
        }
        if (!(codePresenceCredit >= 0.0 && codePresenceCredit <= 1.0)) {
            throw new IllegalArgumentException("codePresenceCredit must be in [0, 1]");
        }
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(ScoreWeights.defaults(), FreshnessPolicy.defaults(),
            NoveltyPolicy.defaults(), Duration.ofDays(23), 0.5, 0.2);
    }
}

package com.paperradar.ranking.engine;

import java.time.Duration;

/**
 * @param enabled              whether the periodic loop starts with the application
 * @param deadline             wall-clock budget of one cycle
 * @param parallelism          scoring workers
 * @param degradedFailureRatio share of failed artifacts above which a cycle is DEGRADED
 * @param topN                 length of the cached leaderboard
 * @param trendingN            length of the cached trending list
 */
public record CyclePolicy(
    boolean enabled,
    Duration initialDelay,
    Duration interval,
    Duration deadline,
    int parallelism,
    double degradedFailureRatio,
    int topN,
    int trendingN
) {

    public CyclePolicy {
        requirePositive("interval", interval);
        requirePositive("deadline", deadline);
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0, was " + initialDelay);
        }
        if (deadline.compareTo(interval) > 0) {
            throw new IllegalArgumentException("deadline " + deadline + " exceeds interval " + interval);
        }
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0, was " + parallelism);
        if (!(degradedFailureRatio >= 0.0 && degradedFailureRatio <= 1.0)) {
            throw new IllegalArgumentException("degradedFailureRatio must be in [0, 1], was " + degradedFailureRatio);
        }
        if (topN <= 0 || trendingN <= 0) throw new IllegalArgumentException("topN and trendingN must be > 0");
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + d);
        }
    }
}

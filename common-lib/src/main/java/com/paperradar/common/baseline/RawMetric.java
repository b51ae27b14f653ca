package com.paperradar.common.baseline;

import com.paperradar.common.model.ArtifactMetrics;

/**
 * Raw signals a field baseline keeps order statistics for.
 *
 * <p>Count-like metrics are heavy-tailed and are compared in {@code log1p} space; the
 * author signal is already on a compact scale and is used as-is.
 */
public enum RawMetric {
    CITATIONS(true),
    CITATION_VELOCITY(true),
    REPO_STARS(true),
    SOCIAL_SIGNAL(true),
    AUTHOR_SIGNAL(false);

    private final boolean countLike;

    RawMetric(boolean countLike) {
        this.countLike = countLike;
    }

    public boolean isCountLike() {
        return countLike;
    }

    /** Untransformed value, or {@code null} when the artifact carries no such signal. */
    public Double rawValue(ArtifactMetrics a) {
        return switch (this) {
            case CITATIONS         -> (double) a.citationCount();
            case CITATION_VELOCITY -> (double) a.recentVelocity();
            case REPO_STARS        -> (double) a.repoStars();
            case SOCIAL_SIGNAL     -> (double) a.socialSignal();
            case AUTHOR_SIGNAL     -> a.authorSignal();
        };
    }

    /** Value in the space percentiles are computed in. */
    public double transform(double raw) {
        return countLike ? Math.log1p(Math.max(0.0, raw)) : raw;
    }
}

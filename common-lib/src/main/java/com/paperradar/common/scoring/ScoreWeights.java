package com.paperradar.common.scoring;

/**
 * Component weights of the total score. Each weight is non-negative and together they sum
 * to 1.0, so a total built from unit-range components stays in [0, 1] before the boost.
 */
public record ScoreWeights(
    double citationMomentum,
    double implementationQuality,
    double authorCredibility,
    double novelty,
    double reproducibility,
    double communityEngagement,
    double recency
) {

    static final double SUM_TOLERANCE = 1e-9;

    public ScoreWeights {
        double[] all = {citationMomentum, implementationQuality, authorCredibility, novelty,
            reproducibility, communityEngagement, recency};
        double sum = 0.0;
        for (double w : all) {
            if (!(w >= 0.0) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("weights must be finite and >= 0, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0, sum was " + sum);
        }
    }

    public static ScoreWeights defaults() {
        return new ScoreWeights(0.25, 0.20, 0.15, 0.15, 0.10, 0.10, 0.05);
    }
}

package com.paperradar.common.scoring;

/**
 * @param semanticWeight   share of embedding dissimilarity in the blend
 * @param keywordWeight    share of keyword rarity; the two shares sum to 1
 * @param fallbackDiscount multiplier applied to keyword novelty when no vector is available
 * @param neighbours       neighbours averaged for semantic dissimilarity
 */
public record NoveltyPolicy(double semanticWeight, double keywordWeight, double fallbackDiscount, int neighbours) {

    public NoveltyPolicy {
        if (semanticWeight < 0 || keywordWeight < 0 || Math.abs(semanticWeight + keywordWeight - 1.0) > 1e-9) {
            throw new IllegalArgumentException("novelty weights must be >= 0 and sum to 1.0, got "
                + semanticWeight + " + " + keywordWeight);
        }
        if (!(fallbackDiscount >= 0.0 && fallbackDiscount <= 1.0)) {
            throw new IllegalArgumentException("fallbackDiscount must be in [0, 1], was " + fallbackDiscount);
        }
        if (neighbours <= 0) throw new IllegalArgumentException("neighbours must be > 0, was " + neighbours);
    }

    public static NoveltyPolicy defaults() {
        return new NoveltyPolicy(0.6, 0.4, 0.8, 10);
    }
}

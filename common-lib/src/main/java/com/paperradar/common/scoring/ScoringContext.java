package com.paperradar.common.scoring;

import java.time.Instant;

/**
 * Inputs shared by every artifact of one cycle: the reference time all ages are measured
 * from, and the novelty snapshot built over the cycle's population.
 */
public record ScoringContext(Instant asOf, NoveltyEstimator novelty) {

    public ScoringContext {
        if (asOf == null) throw new IllegalArgumentException("asOf must not be null");
        if (novelty == null) throw new IllegalArgumentException("novelty must not be null");
    }
}

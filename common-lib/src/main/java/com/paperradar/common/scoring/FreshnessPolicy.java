package com.paperradar.common.scoring;

import java.time.Duration;

/**
 * Boost for young artifacts that already show traction.
 *
 * @param ageThreshold  artifacts at least this old get no boost
 * @param maxMultiplier boost at age zero; decays linearly to 1.0 at the threshold
 * @param tractionFloor minimum citations plus social mentions to qualify
 */
public record FreshnessPolicy(Duration ageThreshold, double maxMultiplier, long tractionFloor) {

    public FreshnessPolicy {
        if (ageThreshold == null || ageThreshold.isNegative() || ageThreshold.isZero()) {
            throw new IllegalArgumentException("ageThreshold must be positive, was " + ageThreshold);
        }
        if (!(maxMultiplier >= 1.0) || Double.isInfinite(maxMultiplier)) {
            throw new IllegalArgumentException("maxMultiplier must be >= 1.0, was " + maxMultiplier);
        }
        if (tractionFloor < 0) throw new IllegalArgumentException("tractionFloor must be >= 0, was " + tractionFloor);
    }

    public static FreshnessPolicy defaults() {
        return new FreshnessPolicy(Duration.ofDays(30), 1.5, 1);
    }
}

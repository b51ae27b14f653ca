package com.paperradar.common.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#acquire}. A {@code WAIT} does not hold a token: the caller
 * sleeps for {@code waitFor} and asks again.
 */
public record Acquisition(Decision decision, Duration waitFor, String reason) {

    public enum Decision {
        GRANTED,
        WAIT,
        REJECTED
    }

    static Acquisition granted(String reason) {
        return new Acquisition(Decision.GRANTED, Duration.ZERO, reason);
    }

    static Acquisition waitFor(Duration wait, String reason) {
        return new Acquisition(Decision.WAIT, wait, reason);
    }

    static Acquisition rejected(Duration wouldWait, String reason) {
        return new Acquisition(Decision.REJECTED, wouldWait, reason);
    }

    public boolean isGranted() {
        return decision == Decision.GRANTED;
    }
}

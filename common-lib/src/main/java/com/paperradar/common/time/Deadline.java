package com.paperradar.common.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time by which a piece of cycle work must finish. Passed down to
 * population fetches, limiter waits and single-flight waits so each can bound itself.
 */
public record Deadline(Instant expiresAt) {

    private static final Instant UNBOUNDED = Instant.parse("9999-12-31T23:59:59Z");

    public Deadline {
        if (expiresAt == null) throw new IllegalArgumentException("expiresAt must not be null");
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget));
    }

    public static Deadline unbounded() {
        return new Deadline(UNBOUNDED);
    }

    public boolean isBounded() {
        return !UNBOUNDED.equals(expiresAt);
    }

    /** Time left, never negative. */
    public Duration remaining(Clock clock) {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    /** The smaller of {@code limit} and the time left. */
    public Duration cap(Duration limit, Clock clock) {
        Duration left = remaining(clock);
        return left.compareTo(limit) < 0 ? left : limit;
    }
}

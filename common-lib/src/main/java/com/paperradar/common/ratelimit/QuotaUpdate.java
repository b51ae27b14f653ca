package com.paperradar.common.ratelimit;

import java.time.Duration;

/**
 * Quota facts a provider reported on a response. Every field is nullable: providers send
 * any subset.
 *
 * @param limit      requests allowed per quota window
 * @param remaining  requests left in the current window
 * @param resetAfter time until the window resets
 * @param retryAfter explicit wait the provider asked for
 */
public record QuotaUpdate(Integer limit, Integer remaining, Duration resetAfter, Duration retryAfter) {

    public boolean isEmpty() {
        return limit == null && remaining == null && resetAfter == null && retryAfter == null;
    }
}

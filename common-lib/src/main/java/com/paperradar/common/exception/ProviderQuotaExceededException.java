package com.paperradar.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * A provider refused a call because its quota is spent (HTTP 429), or the local limiter
 * refused admission. Retryable within the caller's deadline.
 */
public class ProviderQuotaExceededException extends RankingException {
    private final String provider;
    private final Duration retryAfter;

    public ProviderQuotaExceededException(String provider, Duration retryAfter, String message) {
        super("provider:" + provider, message);
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public String getProvider() {
        return provider;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}

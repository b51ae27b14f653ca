package com.paperradar.common.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * The de-facto {@code X-RateLimit-*} family plus {@code Retry-After}.
 *
 * <ul>
 *   <li>{@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining}: integers</li>
 *   <li>{@code X-RateLimit-Reset}: epoch seconds when above {@value #EPOCH_THRESHOLD},
 *       otherwise seconds until reset</li>
 *   <li>{@code Retry-After}: delta seconds or an HTTP date</li>
 * </ul>
 * Unparseable values are skipped with a debug log; they never fail the call.
 */
public class StandardQuotaHeaderParser implements QuotaHeaderParser {

    private static final Logger log = LoggerFactory.getLogger(StandardQuotaHeaderParser.class);

    static final String LIMIT = "X-RateLimit-Limit";
    static final String REMAINING = "X-RateLimit-Remaining";
    static final String RESET = "X-RateLimit-Reset";
    static final String RETRY_AFTER = "Retry-After";

    static final long EPOCH_THRESHOLD = 1_000_000_000L;

    @Override
    public Optional<QuotaUpdate> parse(Map<String, String> headers, Instant now) {
        if (headers == null || headers.isEmpty()) return Optional.empty();
        QuotaUpdate update = new QuotaUpdate(
            integer(header(headers, LIMIT)),
            integer(header(headers, REMAINING)),
            reset(header(headers, RESET), now),
            retryAfter(header(headers, RETRY_AFTER), now));
        return update.isEmpty() ? Optional.empty() : Optional.of(update);
    }

    private static String header(Map<String, String> headers, String name) {
        String exact = headers.get(name);
        if (exact != null) return exact.trim();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && e.getValue() != null) {
                return e.getValue().trim();
            }
        }
        return null;
    }

    private static Integer integer(String value) {
        if (value == null || value.isEmpty()) return null;
        try {
            int parsed = (int) Double.parseDouble(value);
            return Math.max(0, parsed);
        } catch (NumberFormatException e) {
            log.debug("QUOTA_HEADER_UNPARSEABLE value='{}'", value);
            return null;
        }
    }

    private static Duration reset(String value, Instant now) {
        if (value == null || value.isEmpty()) return null;
        try {
            double seconds = Double.parseDouble(value);
            if (seconds > EPOCH_THRESHOLD) {
                Duration d = Duration.between(now, Instant.ofEpochMilli((long) (seconds * 1000)));
                return d.isNegative() ? Duration.ZERO : d;
            }
            return Duration.ofMillis((long) (Math.max(0.0, seconds) * 1000));
        } catch (NumberFormatException e) {
            log.debug("QUOTA_HEADER_UNPARSEABLE header={} value='{}'", RESET, value);
            return null;
        }
    }

    private static Duration retryAfter(String value, Instant now) {
        if (value == null || value.isEmpty()) return null;
        try {
            return Duration.ofSeconds(Math.max(0L, Long.parseLong(value)));
        } catch (NumberFormatException notSeconds) {
            try {
                Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                Duration d = Duration.between(now, at);
                return d.isNegative() ? Duration.ZERO : d;
            } catch (DateTimeParseException notDate) {
                log.debug("QUOTA_HEADER_UNPARSEABLE header={} value='{}'", RETRY_AFTER, value);
                return null;
            }
        }
    }
}

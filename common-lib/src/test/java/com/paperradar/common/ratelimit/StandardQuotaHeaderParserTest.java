package com.paperradar.common.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StandardQuotaHeaderParserTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final StandardQuotaHeaderParser parser = new StandardQuotaHeaderParser();

    @Test
    @DisplayName("small reset values are seconds from now")
    void deltaReset() {
        QuotaUpdate u = parser.parse(Map.of("X-RateLimit-Reset", "45"), NOW).orElseThrow();
        assertEquals(Duration.ofSeconds(45), u.resetAfter());
    }

    @Test
    @DisplayName("large reset values are epoch seconds")
    void epochReset() {
        long epoch = NOW.plusSeconds(90).getEpochSecond();
        QuotaUpdate u = parser.parse(Map.of("X-RateLimit-Reset", Long.toString(epoch)), NOW).orElseThrow();
        assertEquals(Duration.ofSeconds(90), u.resetAfter());
    }

    @Test
    @DisplayName("an epoch reset in the past reads as zero")
    void pastEpochReset() {
        long epoch = NOW.minusSeconds(10).getEpochSecond();
        QuotaUpdate u = parser.parse(Map.of("X-RateLimit-Reset", Long.toString(epoch)), NOW).orElseThrow();
        assertEquals(Duration.ZERO, u.resetAfter());
    }

    @Test
    @DisplayName("header names match regardless of case")
    void caseInsensitive() {
        QuotaUpdate u = parser.parse(Map.of("x-ratelimit-limit", "5000", "X-RATELIMIT-REMAINING", "4999"), NOW)
            .orElseThrow();
        assertEquals(Integer.valueOf(5000), u.limit());
        assertEquals(Integer.valueOf(4999), u.remaining());
    }

    @Test
    @DisplayName("Retry-After accepts seconds and HTTP dates")
    void retryAfterFormats() {
        assertEquals(Duration.ofSeconds(120),
            parser.parse(Map.of("Retry-After", "120"), NOW).orElseThrow().retryAfter());
        assertEquals(Duration.ofSeconds(30),
            parser.parse(Map.of("Retry-After", "Sun, 1 Mar 2026 12:00:30 GMT"), NOW).orElseThrow().retryAfter());
    }

    @Test
    @DisplayName("garbage and unrelated headers yield no update")
    void nothingUsable() {
        assertTrue(parser.parse(Map.of("X-RateLimit-Remaining", "lots", "Content-Type", "application/json"), NOW)
            .isEmpty());
        assertTrue(parser.parse(Map.of(), NOW).isEmpty());
    }
}

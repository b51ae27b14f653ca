package com.paperradar.common.ratelimit;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** Reads provider quota headers. Providers disagree on the format, hence pluggable. */
@FunctionalInterface
public interface QuotaHeaderParser {

    /**
     * @param headers response headers, one value per name; lookups ignore case
     * @param now     reference time for absolute reset timestamps
     */
    Optional<QuotaUpdate> parse(Map<String, String> headers, Instant now);
}
